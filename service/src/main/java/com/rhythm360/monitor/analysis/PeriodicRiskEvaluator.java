package com.rhythm360.monitor.analysis;

import com.rhythm360.monitor.ingest.FeatureWindow;
import java.util.Optional;

/**
 * Coarse risk score over the whole feature window, computed on the session's fixed cadence
 * rather than per sample.
 */
public final class PeriodicRiskEvaluator {
  public static final int MIN_WINDOW_SIZE = 60;
  public static final double CRITICAL_THRESHOLD = 0.7;

  private PeriodicRiskEvaluator() {
  }

  public static Optional<RiskEvaluation> evaluate(FeatureWindow window, boolean exercising) {
    if (window.size() < MIN_WINDOW_SIZE) {
      return Optional.empty();
    }
    WindowFeatures features = WindowStatistics.features(window.values());
    return Optional.of(new RiskEvaluation(features, score(features, exercising)));
  }

  public static double score(WindowFeatures features, boolean exercising) {
    double score = 0d;
    if (features.mean() > 100 && !exercising) score += 0.3;
    if (features.stdDev() > 20) score += 0.3;
    if (features.pnn50() < 0.05) score += 0.4;
    return Math.max(0d, Math.min(1d, score));
  }
}
