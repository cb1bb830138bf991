package com.rhythm360.monitor.scoring;

import com.rhythm360.monitor.analysis.WindowStatistics;
import java.util.List;

/**
 * Classifies the beat-interval pattern of the buffered heart rates. Each value is converted to an
 * RR-equivalent interval ({@code 60000 / bpm}) before the statistics are taken.
 */
public final class PatternScorer {
  public static final String INSUFFICIENT_DATA = ModelOutput.INSUFFICIENT_DATA;
  public static final String BRADYCARDIA = "Low(Bradycardia)";
  public static final String TACHYCARDIA = "High(Tachycardia)";
  public static final String IRREGULAR = "Irregular";
  public static final String NORMAL = "Normal";
  public static final String VARIABLE = "Variable";

  static final int MIN_INTERVALS = 5;
  static final int MIN_INTERVALS_FOR_IRREGULAR = 20;

  private PatternScorer() {
  }

  public static ModelOutput score(List<Double> heartRates) {
    double[] rr = rrIntervals(heartRates);
    if (rr.length < MIN_INTERVALS) {
      return ModelOutput.insufficientData();
    }
    double meanRr = WindowStatistics.mean(rr);
    double stdRr = WindowStatistics.stdDev(rr);
    double rmssd = WindowStatistics.rmssd(rr);
    double hr = 60000d / meanRr;

    if (hr < 45) {
      return new ModelOutput(BRADYCARDIA, 0.90);
    }
    if (hr > 110) {
      return new ModelOutput(TACHYCARDIA, 0.92);
    }
    if (rr.length >= MIN_INTERVALS_FOR_IRREGULAR && (stdRr > 200 || rmssd > 150)) {
      return new ModelOutput(IRREGULAR, 0.95);
    }
    if (hr >= 60 && hr <= 100 && stdRr <= 100) {
      return new ModelOutput(NORMAL, 0.88);
    }
    return new ModelOutput(VARIABLE, 0.75);
  }

  // Non-positive readings have no interval equivalent and are skipped.
  static double[] rrIntervals(List<Double> heartRates) {
    return heartRates.stream()
        .filter(v -> v != null && v > 0)
        .mapToDouble(v -> 60000d / v)
        .toArray();
  }
}
