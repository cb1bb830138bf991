package com.rhythm360.monitor.scoring;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Runs the four scorers and the critical pre-check over one snapshot. Stateless; safe to call
 * from any worker thread.
 */
public class ScoringEnsemble {
  private final FitnessProfile profile;

  public ScoringEnsemble(FitnessProfile profile) {
    this.profile = profile;
  }

  public Assessment assess(HealthSnapshot snapshot, Instant timestamp) {
    int samples = snapshot.sampleCount();
    ModelOutput rhythm = RhythmScorer.score(
        samples, snapshot.meanHeartRate(), snapshot.stdHeartRate(), snapshot.pnn50());
    ModelOutput risk = RiskScorer.score(
        samples,
        snapshot.meanHeartRate(),
        snapshot.hrvMean(),
        snapshot.respiratoryRate(),
        snapshot.activityLevel(),
        snapshot.sleepQuality());
    ModelOutput pattern = PatternScorer.score(snapshot.recentHeartRates());
    FitnessOutput fitness = FitnessScorer.score(snapshot, profile);
    return new Assessment(
        UUID.randomUUID(),
        rhythm,
        risk,
        pattern,
        fitness,
        AssessmentAggregator.overallStatus(rhythm, risk, pattern),
        timestamp);
  }

  public List<CriticalSignal> preCheck(HealthSnapshot snapshot) {
    return CriticalPreCheck.check(snapshot);
  }
}
