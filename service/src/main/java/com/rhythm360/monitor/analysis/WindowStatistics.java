package com.rhythm360.monitor.analysis;

public final class WindowStatistics {
  /** Successive-difference threshold of the pNN50-like ratio, in bpm. */
  public static final double PNN50_THRESHOLD_BPM = 50d / 60d;

  private WindowStatistics() {
  }

  public static double mean(double[] values) {
    if (values.length == 0) return 0d;
    double sum = 0d;
    for (double v : values) {
      sum += v;
    }
    return sum / values.length;
  }

  // Population deviation (divides by n), matching the windowed checks.
  public static double stdDev(double[] values) {
    if (values.length == 0) return 0d;
    double mean = mean(values);
    double acc = 0d;
    for (double v : values) {
      acc += (v - mean) * (v - mean);
    }
    return Math.sqrt(acc / values.length);
  }

  public static double pnn50Like(double[] values) {
    return pnn50Like(values, PNN50_THRESHOLD_BPM);
  }

  public static double pnn50Like(double[] values, double threshold) {
    if (values.length < 2) return 0d;
    int exceeding = 0;
    for (int i = 1; i < values.length; i++) {
      if (Math.abs(values[i] - values[i - 1]) > threshold) {
        exceeding++;
      }
    }
    return (double) exceeding / (values.length - 1);
  }

  public static double rmssd(double[] values) {
    if (values.length < 2) return 0d;
    double acc = 0d;
    for (int i = 1; i < values.length; i++) {
      double diff = values[i] - values[i - 1];
      acc += diff * diff;
    }
    return Math.sqrt(acc / (values.length - 1));
  }

  public static WindowFeatures features(double[] values) {
    return new WindowFeatures(mean(values), stdDev(values), pnn50Like(values), values.length);
  }
}
