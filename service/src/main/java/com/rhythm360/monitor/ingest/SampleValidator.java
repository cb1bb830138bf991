package com.rhythm360.monitor.ingest;

public final class SampleValidator {
  public static final double MIN_VALUE = 20.0;
  public static final double MAX_VALUE = 300.0;

  private SampleValidator() {
  }

  public static boolean isValid(double value) {
    return Double.isFinite(value) && value >= MIN_VALUE && value <= MAX_VALUE;
  }

  public static boolean isValid(Sample sample) {
    return sample != null && sample.timestamp() != null && sample.mode() != null
        && isValid(sample.value());
  }
}
