package com.rhythm360.monitor.sensor;

import java.time.Duration;
import java.util.Optional;

/**
 * Boundary to the physiological sensor: a push stream of heart-rate samples plus pull queries for
 * the slower aggregates. An empty result means no reading within {@code range}; callers apply
 * their own defaults.
 */
public interface SensorGateway {

  /**
   * @throws SensorUnavailableException when the device cannot be read (missing permission, sensor
   *     disabled)
   */
  SensorSubscription subscribe(String deviceId, SampleListener listener);

  Optional<Double> latestRespiratoryRate(String deviceId, Duration range);

  Optional<Double> latestActivityEnergy(String deviceId, Duration range);

  Optional<Double> latestSleepRatio(String deviceId, Duration range);

  Optional<Double> latestHrv(String deviceId, Duration range);
}
