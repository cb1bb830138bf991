package com.rhythm360.monitor.scoring;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AssessmentAggregatorTest {

  private static ModelOutput out(String label) {
    return new ModelOutput(label, 0.9);
  }

  @Test
  void anyIrregularOrHighRiskNeedsAttention() {
    assertEquals(OverallStatus.NEEDS_ATTENTION, AssessmentAggregator.overallStatus(
        out(RhythmScorer.IRREGULAR), out(RiskScorer.LOW), out(PatternScorer.NORMAL)));
    assertEquals(OverallStatus.NEEDS_ATTENTION, AssessmentAggregator.overallStatus(
        out(RhythmScorer.NORMAL), out(RiskScorer.HIGH), out(PatternScorer.NORMAL)));
    assertEquals(OverallStatus.NEEDS_ATTENTION, AssessmentAggregator.overallStatus(
        out(RhythmScorer.NORMAL), out(RiskScorer.MEDIUM), out(PatternScorer.IRREGULAR)));
  }

  @Test
  void mediumRiskOrRateExtremesMeanMonitor() {
    assertEquals(OverallStatus.MONITOR, AssessmentAggregator.overallStatus(
        out(RhythmScorer.NORMAL), out(RiskScorer.MEDIUM), out(PatternScorer.NORMAL)));
    assertEquals(OverallStatus.MONITOR, AssessmentAggregator.overallStatus(
        out(RhythmScorer.NORMAL), out(RiskScorer.LOW), out(PatternScorer.TACHYCARDIA)));
    assertEquals(OverallStatus.MONITOR, AssessmentAggregator.overallStatus(
        out(RhythmScorer.NORMAL), out(RiskScorer.LOW), out(PatternScorer.BRADYCARDIA)));
  }

  @Test
  void otherwiseHealthy() {
    assertEquals(OverallStatus.HEALTHY, AssessmentAggregator.overallStatus(
        out(RhythmScorer.NORMAL), out(RiskScorer.LOW), out(PatternScorer.VARIABLE)));
    assertEquals(OverallStatus.HEALTHY, AssessmentAggregator.overallStatus(
        out(RhythmScorer.NORMAL), out(RiskScorer.LOW), out(PatternScorer.INSUFFICIENT_DATA)));
  }

  @Test
  void aggregationIsIdempotent() {
    var rhythm = out(RhythmScorer.NORMAL);
    var risk = out(RiskScorer.MEDIUM);
    var pattern = out(PatternScorer.NORMAL);
    var first = AssessmentAggregator.overallStatus(rhythm, risk, pattern);
    for (int i = 0; i < 5; i++) {
      assertEquals(first, AssessmentAggregator.overallStatus(rhythm, risk, pattern));
    }
  }
}
