package com.rhythm360.monitor.alert;

import com.rhythm360.monitor.analysis.WindowStatistics;
import com.rhythm360.monitor.ingest.FeatureWindow;
import com.rhythm360.monitor.ingest.Sample;
import com.rhythm360.monitor.notify.Notification;
import com.rhythm360.monitor.notify.NotificationUrgency;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Edge-triggered alert state machine. The status is recomputed from every sample (plus an
 * irregularity overlay over the feature window); a notification is emitted only when the status
 * changes into a non-normal state and the cooldown since the last emitted notification has
 * passed. A suppressed notification still updates the status.
 */
public class AlertEngine {
  private static final Logger log = LoggerFactory.getLogger(AlertEngine.class);

  public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(300);
  static final double RESTING_HIGH = 100.0;
  static final double RESTING_LOW = 50.0;
  static final double EXERCISE_HIGH = 180.0;
  static final int IRREGULARITY_WINDOW = 10;
  static final double IRREGULARITY_STD_DEV = 15.0;

  private final String deviceId;
  private final Duration cooldown;
  private final Consumer<Notification> sink;

  private AlertStatus status = AlertStatus.NORMAL;
  private Instant lastNotifiedAt;

  public AlertEngine(String deviceId, Duration cooldown, Consumer<Notification> sink) {
    this.deviceId = deviceId;
    this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  public AlertStatus onSample(Sample sample, FeatureWindow window, Instant now) {
    AlertStatus previous = status;
    double value = sample.value();
    Notification pending = null;

    if (sample.exercising()) {
      if (value > EXERCISE_HIGH) {
        status = AlertStatus.WARNING;
        pending = notification("High Heart Rate During Exercise",
            "Your heart rate is " + (int) value + " bpm. Consider reducing intensity.",
            NotificationUrgency.MEDIUM);
      } else {
        status = AlertStatus.NORMAL;
      }
    } else if (value > RESTING_HIGH) {
      status = AlertStatus.CRITICAL;
      pending = notification("High Resting Heart Rate",
          "Your resting heart rate is " + (int) value + " bpm. This may require attention.",
          NotificationUrgency.HIGH);
    } else if (value > 0 && value < RESTING_LOW) {
      status = AlertStatus.WARNING;
      pending = notification("Low Heart Rate Detected",
          "Your heart rate is " + (int) value + " bpm. Monitor for symptoms.",
          NotificationUrgency.MEDIUM);
    } else {
      status = AlertStatus.NORMAL;
    }

    if (!sample.exercising() && status == AlertStatus.NORMAL
        && window.size() >= IRREGULARITY_WINDOW
        && WindowStatistics.stdDev(window.recent(IRREGULARITY_WINDOW)) > IRREGULARITY_STD_DEV) {
      status = AlertStatus.MONITORING;
      pending = notification("Irregular Heart Rhythm Detected",
          "Your heart rhythm appears irregular. Opening live monitor.",
          NotificationUrgency.MEDIUM);
    }

    if (status != previous && pending != null) {
      emit(pending, now);
    }
    return status;
  }

  /** Escalates to critical regardless of the current status; emission remains cooldown-gated. */
  public AlertStatus forceCritical(String title, String body, Instant now) {
    status = AlertStatus.CRITICAL;
    emit(notification(title, body, NotificationUrgency.HIGH), now);
    return status;
  }

  private void emit(Notification notification, Instant now) {
    if (lastNotifiedAt != null && Duration.between(lastNotifiedAt, now).compareTo(cooldown) < 0) {
      log.debug("Suppressing '{}' for device {}: cooldown active since {}",
          notification.title(), deviceId, lastNotifiedAt);
      return;
    }
    lastNotifiedAt = now;
    try {
      sink.accept(notification);
    } catch (RuntimeException ex) {
      log.warn("Dropping notification '{}' for device {}: {}", notification.title(), deviceId,
          ex.getMessage());
    }
  }

  private Notification notification(String title, String body, NotificationUrgency urgency) {
    return new Notification(deviceId, title, body, urgency);
  }

  public AlertState state() {
    return new AlertState(status, lastNotifiedAt);
  }

  public AlertStatus status() {
    return status;
  }

  public void reset() {
    status = AlertStatus.NORMAL;
    lastNotifiedAt = null;
  }
}
