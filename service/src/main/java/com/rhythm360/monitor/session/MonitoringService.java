package com.rhythm360.monitor.session;

import com.rhythm360.monitor.assessment.AssessmentReport;
import com.rhythm360.monitor.assessment.AssessmentService;
import com.rhythm360.monitor.notify.NotificationDispatcher;
import com.rhythm360.monitor.sensor.SensorGateway;
import com.rhythm360.monitor.sensor.SensorUnavailableException;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class MonitoringService {
  private static final Logger log = LoggerFactory.getLogger(MonitoringService.class);

  private final SensorGateway sensors;
  private final NotificationDispatcher notifications;
  private final AssessmentService assessments;
  private final Clock clock;
  private final MonitoringOptions defaults;
  private final Map<String, MonitoringSession> sessions = new ConcurrentHashMap<>();

  public MonitoringService(
      SensorGateway sensors,
      NotificationDispatcher notifications,
      AssessmentService assessments,
      Clock clock,
      @Value("${monitor.buffer.ring-capacity:200}") int ringCapacity,
      @Value("${monitor.buffer.window-capacity:300}") int windowCapacity,
      @Value("${monitor.zone.estimated-max-hr:190}") double estimatedMaxHr,
      @Value("${monitor.analysis.period:PT60S}") Duration analysisPeriod,
      @Value("${monitor.alert.cooldown:PT300S}") Duration alertCooldown,
      @Value("${monitor.session.queue-capacity:1024}") int queueCapacity
  ) {
    this.sensors = sensors;
    this.notifications = notifications;
    this.assessments = assessments;
    this.clock = clock;
    this.defaults = new MonitoringOptions(ringCapacity, windowCapacity, estimatedMaxHr,
        analysisPeriod, alertCooldown, queueCapacity);
  }

  public MonitoringOptions defaults() {
    return defaults;
  }

  public MonitoringSession start(String deviceId) {
    return start(deviceId, defaults);
  }

  /**
   * Starts monitoring the device, or returns the running session unchanged.
   *
   * @throws MonitoringConfigurationException when the sensor cannot be subscribed
   */
  public MonitoringSession start(String deviceId, MonitoringOptions options) {
    MonitoringSession existing = sessions.get(deviceId);
    if (existing != null && existing.isActive()) {
      log.debug("Session for device {} already running", deviceId);
      return existing;
    }
    synchronized (sessions) {
      existing = sessions.get(deviceId);
      if (existing != null && existing.isActive()) {
        return existing;
      }
      MonitoringSession session =
          new MonitoringSession(deviceId, options, notifications::dispatch, clock);
      try {
        session.start(sensors);
      } catch (SensorUnavailableException ex) {
        log.warn("Cannot start monitoring for device {}: {}", deviceId, ex.getMessage());
        throw new MonitoringConfigurationException(deviceId, ex.getMessage(), ex);
      }
      sessions.put(deviceId, session);
      return session;
    }
  }

  /** Returns true when a running session was stopped. */
  public boolean stop(String deviceId) {
    MonitoringSession session = sessions.remove(deviceId);
    if (session == null) {
      return false;
    }
    session.stop();
    return true;
  }

  public CompletableFuture<SessionView> snapshot(String deviceId) {
    return session(deviceId).view();
  }

  /** Runs one assessment cycle over the session's current buffer and publishes it. */
  public CompletableFuture<AssessmentReport> evaluateNow(String deviceId) {
    MonitoringSession session = session(deviceId);
    return session.heartRates()
        .thenCompose(values -> assessments.assess(deviceId, values))
        .thenApply(report -> {
          session.publish(report);
          return report;
        });
  }

  public MonitoringSession session(String deviceId) {
    MonitoringSession session = sessions.get(deviceId);
    if (session == null || !session.isActive()) {
      throw new SessionNotFoundException(deviceId);
    }
    return session;
  }

  public Set<String> activeDevices() {
    return Set.copyOf(sessions.keySet());
  }

  @PreDestroy
  public void stopAll() {
    for (String deviceId : activeDevices()) {
      stop(deviceId);
    }
  }
}
