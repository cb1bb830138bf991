package com.rhythm360.monitor.assessment;

import com.rhythm360.monitor.cache.OfflineAssessmentCache;
import com.rhythm360.monitor.cache.OfflineReplayQueue;
import com.rhythm360.monitor.cache.PendingAssessment;
import com.rhythm360.monitor.scoring.Assessment;
import com.rhythm360.monitor.scoring.CriticalSignal;
import com.rhythm360.monitor.scoring.HealthSnapshot;
import com.rhythm360.monitor.scoring.ScoringEnsemble;
import com.rhythm360.monitor.sensor.SensorGateway;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * One assessment cycle over an immutable copy of a session's buffered heart rates: pull the
 * aggregates, score, persist, cache. A failed write is queued for replay and does not fail the
 * cycle. A cycle over an empty buffer is rejected with {@link InsufficientDataException} and
 * neither persisted nor cached.
 */
@Service
public class AssessmentService {
  private static final Logger log = LoggerFactory.getLogger(AssessmentService.class);

  private final ScoringEnsemble ensemble;
  private final SensorGateway sensors;
  private final AssessmentStore store;
  private final OfflineAssessmentCache cache;
  private final OfflineReplayQueue replayQueue;
  private final Executor scoringExecutor;
  private final Clock clock;
  private final Duration aggregateRange;

  public AssessmentService(
      ScoringEnsemble ensemble,
      SensorGateway sensors,
      AssessmentStore store,
      OfflineAssessmentCache cache,
      OfflineReplayQueue replayQueue,
      @Qualifier("scoringExecutor") Executor scoringExecutor,
      Clock clock,
      @Value("${monitor.sensor.aggregate-range:PT24H}") Duration aggregateRange
  ) {
    this.ensemble = ensemble;
    this.sensors = sensors;
    this.store = store;
    this.cache = cache;
    this.replayQueue = replayQueue;
    this.scoringExecutor = scoringExecutor;
    this.clock = clock;
    this.aggregateRange = aggregateRange;
  }

  public CompletableFuture<AssessmentReport> assess(String deviceId, double[] heartRates) {
    double[] values = heartRates.clone();
    return CompletableFuture.supplyAsync(() -> runCycle(deviceId, values), scoringExecutor);
  }

  AssessmentReport runCycle(String deviceId, double[] heartRates) {
    if (heartRates.length == 0) {
      log.info("Skipping assessment for device {}: no heart-rate samples buffered", deviceId);
      throw new InsufficientDataException(deviceId);
    }
    HealthSnapshot snapshot = snapshot(deviceId, heartRates);
    Assessment assessment = ensemble.assess(snapshot, clock.instant());
    List<CriticalSignal> signals = ensemble.preCheck(snapshot);
    if (!signals.isEmpty()) {
      log.warn("Critical conditions for device {}: {}", deviceId,
          signals.stream().map(s -> s.condition().name()).toList());
    }

    boolean persisted = persist(new PendingAssessment(deviceId, assessment, snapshot));
    cache.store(assessment, snapshot);
    log.info("Assessment {} for device {}: {} (rhythm={}, risk={}, pattern={})",
        assessment.id(), deviceId, assessment.overallStatus().displayName(),
        assessment.rhythm().label(), assessment.risk().label(), assessment.pattern().label());
    return new AssessmentReport(deviceId, assessment, snapshot, signals, persisted);
  }

  HealthSnapshot snapshot(String deviceId, double[] heartRates) {
    double resp = sensors.latestRespiratoryRate(deviceId, aggregateRange)
        .orElse(HealthSnapshot.DEFAULT_RESPIRATORY_RATE);
    double activity = sensors.latestActivityEnergy(deviceId, aggregateRange)
        .orElse(HealthSnapshot.DEFAULT_ACTIVITY_ENERGY);
    double sleep = sensors.latestSleepRatio(deviceId, aggregateRange)
        .orElse(HealthSnapshot.DEFAULT_SLEEP_RATIO);
    double hrv = sensors.latestHrv(deviceId, aggregateRange)
        .orElse(HealthSnapshot.DEFAULT_HRV);
    return HealthSnapshot.of(heartRates, hrv, resp, activity, sleep);
  }

  private boolean persist(PendingAssessment item) {
    if (!replayQueue.isEmpty()) {
      int replayed = replayQueue.replay(this::write);
      if (replayed > 0) {
        log.info("Replayed {} queued assessment(s), {} still pending", replayed,
            replayQueue.size());
      }
    }
    try {
      write(item);
      return true;
    } catch (RuntimeException ex) {
      log.warn("Persisting assessment {} failed, queued for replay: {}",
          item.assessment().id(), ex.getMessage());
      replayQueue.enqueue(item);
      return false;
    }
  }

  private void write(PendingAssessment item) {
    store.save(item.deviceId(), item.assessment(), item.snapshot());
  }

  public int pendingReplays() {
    return replayQueue.size();
  }
}
