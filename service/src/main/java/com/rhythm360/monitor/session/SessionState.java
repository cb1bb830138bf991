package com.rhythm360.monitor.session;

import com.rhythm360.monitor.alert.AlertEngine;
import com.rhythm360.monitor.alert.AlertStatus;
import com.rhythm360.monitor.analysis.PeriodicRiskEvaluator;
import com.rhythm360.monitor.analysis.RiskEvaluation;
import com.rhythm360.monitor.assessment.AssessmentReport;
import com.rhythm360.monitor.ingest.FeatureWindow;
import com.rhythm360.monitor.ingest.RingBuffer;
import com.rhythm360.monitor.ingest.Sample;
import com.rhythm360.monitor.notify.Notification;
import com.rhythm360.monitor.zone.Zone;
import com.rhythm360.monitor.zone.ZoneClassifier;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Mutable state of one session. Only ever touched from the session's executor thread, so nothing
 * here is synchronized.
 */
final class SessionState {
  static final String RISK_TITLE = "Health Risk Detected";
  static final String RISK_BODY =
      "Periodic analysis detected a potential health risk. Please review your data.";

  private final MonitoringOptions options;
  private final RingBuffer<Sample> samples;
  private final FeatureWindow window;
  private final AlertEngine alerts;

  private Zone zone;
  private Sample latest;

  SessionState(String deviceId, MonitoringOptions options, Consumer<Notification> notifier) {
    this.options = options;
    this.samples = new RingBuffer<>(options.ringCapacity());
    this.window = new FeatureWindow(options.windowCapacity());
    this.alerts = new AlertEngine(deviceId, options.alertCooldown(), notifier);
  }

  AlertStatus accept(Sample sample, Instant now) {
    samples.push(sample);
    window.push(sample.value());
    latest = sample;
    zone = ZoneClassifier.classify(sample.value(), sample.mode(), options.estimatedMaxHr());
    return alerts.onSample(sample, window, now);
  }

  Optional<RiskEvaluation> evaluatePeriodic(Instant now) {
    boolean exercising = latest != null && latest.exercising();
    Optional<RiskEvaluation> evaluation = PeriodicRiskEvaluator.evaluate(window, exercising);
    evaluation.filter(RiskEvaluation::critical)
        .ifPresent(e -> alerts.forceCritical(RISK_TITLE, RISK_BODY, now));
    return evaluation;
  }

  double[] heartRates() {
    return samples.values().stream().mapToDouble(Sample::value).toArray();
  }

  SessionView view(String deviceId, boolean active, long dropped,
      AssessmentReport report) {
    var state = alerts.state();
    return new SessionView(
        deviceId,
        active,
        latest == null ? null : latest.value(),
        latest == null ? null : latest.timestamp(),
        zone,
        state.status(),
        state.lastNotifiedAt(),
        samples.size(),
        window.size(),
        dropped,
        report);
  }

  void clear() {
    samples.clear();
    window.clear();
    alerts.reset();
    zone = null;
    latest = null;
  }
}
