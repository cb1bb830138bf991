package com.rhythm360.monitor.sensor;

import com.rhythm360.monitor.ingest.ActivityMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * In-process sensor gateway fed over HTTP. Samples are fanned out synchronously to the
 * subscribed listeners; aggregates are kept per device with the instant they were received.
 */
@Component
public class PushSensorGateway implements SensorGateway {
  private static final Logger log = LoggerFactory.getLogger(PushSensorGateway.class);

  private final boolean enabled;
  private final Clock clock;
  private final Map<String, List<SampleListener>> listeners = new ConcurrentHashMap<>();
  private final Map<String, DeviceReadings> readings = new ConcurrentHashMap<>();

  public PushSensorGateway(@Value("${monitor.sensor.enabled:true}") boolean enabled, Clock clock) {
    this.enabled = enabled;
    this.clock = clock;
  }

  @Override
  public SensorSubscription subscribe(String deviceId, SampleListener listener) {
    if (!enabled) {
      throw new SensorUnavailableException(deviceId, "Heart-rate sensor access is disabled");
    }
    List<SampleListener> deviceListeners =
        listeners.computeIfAbsent(deviceId, k -> new CopyOnWriteArrayList<>());
    deviceListeners.add(listener);
    log.debug("Subscribed listener to device {} ({} active)", deviceId, deviceListeners.size());
    return () -> deviceListeners.remove(listener);
  }

  /** Fans the sample out to every subscriber of the device; returns how many received it. */
  public int publishSample(String deviceId, double value, Instant timestamp, ActivityMode mode) {
    List<SampleListener> deviceListeners = listeners.getOrDefault(deviceId, List.of());
    for (SampleListener listener : deviceListeners) {
      listener.onSample(value, timestamp, mode);
    }
    return deviceListeners.size();
  }

  public void updateAggregates(String deviceId, SensorAggregates aggregates) {
    Instant now = clock.instant();
    DeviceReadings device = readings.computeIfAbsent(deviceId, k -> new DeviceReadings());
    if (aggregates.respiratoryRate() != null) {
      device.respiratoryRate = new Reading(aggregates.respiratoryRate(), now);
    }
    if (aggregates.activityEnergy() != null) {
      device.activityEnergy = new Reading(aggregates.activityEnergy(), now);
    }
    if (aggregates.sleepRatio() != null) {
      device.sleepRatio = new Reading(aggregates.sleepRatio(), now);
    }
    if (aggregates.hrv() != null) {
      device.hrv = new Reading(aggregates.hrv(), now);
    }
  }

  @Override
  public Optional<Double> latestRespiratoryRate(String deviceId, Duration range) {
    return within(device(deviceId).respiratoryRate, range);
  }

  @Override
  public Optional<Double> latestActivityEnergy(String deviceId, Duration range) {
    return within(device(deviceId).activityEnergy, range);
  }

  @Override
  public Optional<Double> latestSleepRatio(String deviceId, Duration range) {
    return within(device(deviceId).sleepRatio, range);
  }

  @Override
  public Optional<Double> latestHrv(String deviceId, Duration range) {
    return within(device(deviceId).hrv, range);
  }

  public int subscriberCount(String deviceId) {
    return listeners.getOrDefault(deviceId, List.of()).size();
  }

  private DeviceReadings device(String deviceId) {
    return readings.getOrDefault(deviceId, DeviceReadings.EMPTY);
  }

  private Optional<Double> within(Reading reading, Duration range) {
    if (reading == null) return Optional.empty();
    Instant cutoff = clock.instant().minus(range);
    return reading.receivedAt().isBefore(cutoff) ? Optional.empty() : Optional.of(reading.value());
  }

  private record Reading(double value, Instant receivedAt) {}

  private static final class DeviceReadings {
    static final DeviceReadings EMPTY = new DeviceReadings();

    volatile Reading respiratoryRate;
    volatile Reading activityEnergy;
    volatile Reading sleepRatio;
    volatile Reading hrv;
  }
}
