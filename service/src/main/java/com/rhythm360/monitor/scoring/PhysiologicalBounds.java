package com.rhythm360.monitor.scoring;

/** Clamps applied to scorer inputs before any threshold is evaluated. */
public final class PhysiologicalBounds {
  private PhysiologicalBounds() {
  }

  public static double heartRate(double hr) {
    return clamp(hr, 30, 250);
  }

  public static double hrv(double hrv) {
    return clamp(hrv, 0, 200);
  }

  public static double respiratoryRate(double rate) {
    return clamp(rate, 8, 30);
  }

  public static double activity(double energy) {
    return clamp(energy, 0, 1000);
  }

  public static double sleepRatio(double ratio) {
    return clamp(ratio, 0, 1);
  }

  public static double clamp(double value, double min, double max) {
    if (Double.isNaN(value)) return min;
    return Math.max(min, Math.min(max, value));
  }
}
