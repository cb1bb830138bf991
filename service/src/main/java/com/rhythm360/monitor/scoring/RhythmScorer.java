package com.rhythm360.monitor.scoring;

/**
 * Weighted-threshold rhythm check over mean heart rate, its deviation and the pNN50-like ratio.
 * An irregularity score of 0.5 or more labels the rhythm irregular.
 */
public final class RhythmScorer {
  public static final String IRREGULAR = "Irregular";
  public static final String NORMAL = "Normal";

  static final int MIN_SAMPLES = 2;

  private RhythmScorer() {
  }

  /** Fewer than two samples give no deviation or successive differences to judge. */
  public static ModelOutput score(int samples, double meanHr, double stdHr, double pnn50) {
    if (samples < MIN_SAMPLES) {
      return ModelOutput.insufficientData();
    }
    return score(meanHr, stdHr, pnn50);
  }

  public static ModelOutput score(double meanHr, double stdHr, double pnn50) {
    double irregularity = irregularity(meanHr, stdHr, pnn50);
    if (irregularity >= 0.5) {
      return new ModelOutput(IRREGULAR, Math.min(irregularity, 0.95));
    }
    return new ModelOutput(NORMAL, Math.max(1d - irregularity, 0.7));
  }

  static double irregularity(double meanHr, double stdHr, double pnn50) {
    double hr = PhysiologicalBounds.heartRate(meanHr);
    double std = PhysiologicalBounds.clamp(stdHr, 0, 100);
    double p = PhysiologicalBounds.clamp(pnn50, 0, 1);

    double score = 0d;
    if (std > 15) {
      score += 0.4;
    } else if (std > 10) {
      score += 0.2;
    }
    if (p < 0.1 && hr > 85) score += 0.3;
    if (hr > 100 || hr < 50) score += 0.2;
    if (std > 12 && p < 0.08) score += 0.1;
    return score;
  }
}
