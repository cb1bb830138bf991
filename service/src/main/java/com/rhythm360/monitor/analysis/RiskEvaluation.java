package com.rhythm360.monitor.analysis;

public record RiskEvaluation(WindowFeatures features, double score) {

  public boolean critical() {
    return score > PeriodicRiskEvaluator.CRITICAL_THRESHOLD;
  }
}
