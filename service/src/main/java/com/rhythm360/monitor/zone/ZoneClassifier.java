package com.rhythm360.monitor.zone;

import com.rhythm360.monitor.ingest.ActivityMode;

public final class ZoneClassifier {
  public static final double DEFAULT_ESTIMATED_MAX_HR = 190.0;

  private ZoneClassifier() {
  }

  public static Zone classify(double value, ActivityMode mode) {
    return classify(value, mode, DEFAULT_ESTIMATED_MAX_HR);
  }

  public static Zone classify(double value, ActivityMode mode, double estimatedMaxHr) {
    if (mode == ActivityMode.EXERCISE) {
      return exerciseZone(value, estimatedMaxHr);
    }
    return restingZone(value);
  }

  static Zone restingZone(double value) {
    if (value < 50) return Zone.LOW;
    if (value < 60) return Zone.RESTING;
    if (value < 100) return Zone.NORMAL;
    if (value < 120) return Zone.ELEVATED;
    return Zone.HIGH;
  }

  static Zone exerciseZone(double value, double estimatedMaxHr) {
    if (estimatedMaxHr <= 0) {
      throw new IllegalArgumentException("estimatedMaxHr must be positive");
    }
    double pct = value / estimatedMaxHr * 100d;
    if (pct < 50) return Zone.RESTING;
    if (pct < 60) return Zone.WARMUP;
    if (pct < 70) return Zone.FAT_BURN;
    if (pct < 80) return Zone.CARDIO;
    if (pct < 90) return Zone.PEAK;
    return Zone.MAXIMUM;
  }
}
