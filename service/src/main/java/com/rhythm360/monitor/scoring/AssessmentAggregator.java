package com.rhythm360.monitor.scoring;

public final class AssessmentAggregator {
  private AssessmentAggregator() {
  }

  public static OverallStatus overallStatus(ModelOutput rhythm, ModelOutput risk,
      ModelOutput pattern) {
    if (rhythm.is(RhythmScorer.IRREGULAR)
        || risk.is(RiskScorer.HIGH)
        || pattern.is(PatternScorer.IRREGULAR)) {
      return OverallStatus.NEEDS_ATTENTION;
    }
    if (risk.is(RiskScorer.MEDIUM)
        || pattern.is(PatternScorer.TACHYCARDIA)
        || pattern.is(PatternScorer.BRADYCARDIA)) {
      return OverallStatus.MONITOR;
    }
    return OverallStatus.HEALTHY;
  }
}
