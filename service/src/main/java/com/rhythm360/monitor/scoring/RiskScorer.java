package com.rhythm360.monitor.scoring;

/** Three-tier health risk from heart rate, HRV, respiration, activity energy and sleep. */
public final class RiskScorer {
  public static final String HIGH = "High";
  public static final String MEDIUM = "Medium";
  public static final String LOW = "Low";

  private RiskScorer() {
  }

  public static ModelOutput score(int samples, double avgHr, double hrvMean,
      double respiratoryRate, double activity, double sleepRatio) {
    if (samples < 1) {
      return ModelOutput.insufficientData();
    }
    return score(avgHr, hrvMean, respiratoryRate, activity, sleepRatio);
  }

  public static ModelOutput score(double avgHr, double hrvMean, double respiratoryRate,
      double activity, double sleepRatio) {
    double risk = riskScore(avgHr, hrvMean, respiratoryRate, activity, sleepRatio);
    if (risk >= 0.6) {
      return new ModelOutput(HIGH, Math.min(risk + 0.2, 0.95));
    }
    if (risk >= 0.35) {
      return new ModelOutput(MEDIUM, 0.75 + (risk - 0.35) * 0.5);
    }
    return new ModelOutput(LOW, Math.max(0.85 - risk, 0.7));
  }

  static double riskScore(double avgHr, double hrvMean, double respiratoryRate,
      double activity, double sleepRatio) {
    double hr = PhysiologicalBounds.heartRate(avgHr);
    double hrv = PhysiologicalBounds.hrv(hrvMean);
    double resp = PhysiologicalBounds.respiratoryRate(respiratoryRate);
    double energy = PhysiologicalBounds.activity(activity);
    double sleep = PhysiologicalBounds.sleepRatio(sleepRatio);

    double stress = 1d / (1d + Math.exp(-0.1 * (hr - 75)));
    double recovery = sleep * hrv / 50d;

    double score = 0d;
    if (recovery < 0.5) {
      score += 0.4;
    } else if (recovery < 0.8) {
      score += 0.2;
    }
    if (energy < 100) score += 0.2;
    if (stress > 0.7) score += 0.1;
    if (sleep < 0.5) score += 0.1;
    if (resp > 20 || resp < 12) score += 0.1;
    if (hr > 90 && energy < 200) score += 0.1;
    return score;
  }
}
