package com.rhythm360.monitor.scoring;

/**
 * User attributes the fitness scorer cannot derive from the stream. A null baseline means the
 * baseline is taken as two beats below the current resting rate.
 */
public record FitnessProfile(double age, Double baselineRestingHr) {
  public static final double DEFAULT_AGE = 40.0;

  public FitnessProfile {
    if (age <= 0 || age > 120) {
      throw new IllegalArgumentException("age out of range: " + age);
    }
  }

  public static FitnessProfile defaults() {
    return new FitnessProfile(DEFAULT_AGE, null);
  }

  public double maxHeartRate() {
    return 220d - age;
  }

  public double baselineFor(double restingHr) {
    return baselineRestingHr != null ? baselineRestingHr : restingHr - 2d;
  }
}
