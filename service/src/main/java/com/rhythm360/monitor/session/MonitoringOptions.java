package com.rhythm360.monitor.session;

import java.time.Duration;

public record MonitoringOptions(
    int ringCapacity,
    int windowCapacity,
    double estimatedMaxHr,
    Duration analysisPeriod,
    Duration alertCooldown,
    int queueCapacity
) {

  public MonitoringOptions {
    if (ringCapacity < 1 || windowCapacity < 1 || queueCapacity < 1) {
      throw new IllegalArgumentException("buffer and queue capacities must be positive");
    }
    if (estimatedMaxHr <= 0) {
      throw new IllegalArgumentException("estimatedMaxHr must be positive");
    }
    if (analysisPeriod.isZero() || analysisPeriod.isNegative()) {
      throw new IllegalArgumentException("analysisPeriod must be positive");
    }
  }

  public MonitoringOptions withEstimatedMaxHr(double maxHr) {
    return new MonitoringOptions(ringCapacity, windowCapacity, maxHr, analysisPeriod,
        alertCooldown, queueCapacity);
  }
}
