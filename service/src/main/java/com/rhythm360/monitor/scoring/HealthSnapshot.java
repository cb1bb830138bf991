package com.rhythm360.monitor.scoring;

import com.rhythm360.monitor.analysis.WindowStatistics;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable input of one assessment cycle: statistics of the buffered heart rates plus the
 * ancillary aggregates pulled from the sensor gateway.
 */
public record HealthSnapshot(
    double meanHeartRate,
    double stdHeartRate,
    double pnn50,
    double hrvMean,
    double respiratoryRate,
    double activityLevel,
    double sleepQuality,
    List<Double> recentHeartRates
) {

  public static final double DEFAULT_RESPIRATORY_RATE = 16.0;
  public static final double DEFAULT_ACTIVITY_ENERGY = 250.0;
  public static final double DEFAULT_SLEEP_RATIO = 0.8;
  public static final double DEFAULT_HRV = 50.0;

  public HealthSnapshot {
    recentHeartRates = recentHeartRates == null ? List.of() : List.copyOf(recentHeartRates);
  }

  public static HealthSnapshot of(double[] heartRates, double hrvMean, double respiratoryRate,
      double activityLevel, double sleepQuality) {
    List<Double> recent = Arrays.stream(heartRates).boxed().toList();
    return new HealthSnapshot(
        WindowStatistics.mean(heartRates),
        WindowStatistics.stdDev(heartRates),
        WindowStatistics.pnn50Like(heartRates),
        hrvMean,
        respiratoryRate,
        activityLevel,
        sleepQuality,
        recent);
  }

  public int sampleCount() {
    return recentHeartRates.size();
  }

  /** False when no heart rate was buffered; the mean and deviation are then placeholders. */
  public boolean hasHeartRateData() {
    return !recentHeartRates.isEmpty();
  }

  public double[] heartRates() {
    return recentHeartRates.stream().mapToDouble(Double::doubleValue).toArray();
  }
}
