package com.rhythm360.monitor.scoring;

import java.util.ArrayList;
import java.util.List;

/**
 * Cardiovascular fitness and recovery estimate. Resting rate is the snapshot's mean heart rate,
 * RMSSD is approximated by the HRV mean and SDNN by the heart-rate deviation. Heart-rate
 * recovery is estimated from the range of the buffered values since no post-exercise decay is
 * observed directly.
 *
 * <p>Every banded table is evaluated from its most extreme threshold inwards so each band is
 * reachable.
 */
public final class FitnessScorer {
  static final double TIME_TO_TARGET_SECONDS = 120d;

  private FitnessScorer() {
  }

  public static FitnessOutput score(HealthSnapshot snapshot, FitnessProfile profile) {
    double restingHr = PhysiologicalBounds.heartRate(snapshot.meanHeartRate());
    double rmssd = PhysiologicalBounds.hrv(snapshot.hrvMean());
    double sleep = PhysiologicalBounds.sleepRatio(snapshot.sleepQuality());
    double age = profile.age();
    double maxHr = profile.maxHeartRate();
    double hrReserve = maxHr - restingHr;

    double hrr1 = estimateHrr1(snapshot.heartRates());
    double hrr2 = hrr1 * 1.5;

    double fitness = fitnessLevel(age, restingHr, hrr1, rmssd, recoveryEfficiencyBase(hrr1, hrr2));
    double vo2max = vo2max(age, restingHr, maxHr, hrReserve, fitness);
    double cvAge = cardiovascularAge(age, fitness, restingHr, hrr1, rmssd);
    double recovery = recoveryEfficiency(hrr1, hrr2, TIME_TO_TARGET_SECONDS);
    double readiness = trainingReadiness(rmssd, restingHr, profile.baselineFor(restingHr), sleep);

    return new FitnessOutput(
        fitness,
        fitnessCategory(fitness),
        vo2max,
        cvAge,
        ageComparison(cvAge - age),
        recovery,
        recoveryStatus(recovery),
        readiness,
        readinessStatus(readiness),
        recommendation(fitness, recovery, readiness));
  }

  static double estimateHrr1(double[] heartRates) {
    if (heartRates.length == 0) return 20d;
    double max = Double.NEGATIVE_INFINITY;
    double min = Double.POSITIVE_INFINITY;
    for (double v : heartRates) {
      max = Math.max(max, v);
      min = Math.min(min, v);
    }
    double range = max - min;
    if (range > 40) return 25d;
    if (range > 25) return 20d;
    return 15d;
  }

  static double recoveryEfficiencyBase(double hrr1, double hrr2) {
    return Math.min(hrr1 / 30 * 50, 50) + Math.min(hrr2 / 50 * 30, 30) + 20;
  }

  static double fitnessLevel(double age, double restingHr, double hrr1, double rmssd,
      double recoveryBase) {
    double score = 50d;

    if (hrr1 > 30) {
      score += 25;
    } else if (hrr1 > 25) {
      score += 18;
    } else if (hrr1 > 20) {
      score += 10;
    } else if (hrr1 > 15) {
      score += 5;
    } else if (hrr1 < 12) {
      score -= 20;
    }

    if (restingHr < 50) {
      score += 18;
    } else if (restingHr < 55) {
      score += 12;
    } else if (restingHr < 65) {
      score += 6;
    } else if (restingHr > 85) {
      score -= 20;
    } else if (restingHr > 75) {
      score -= 12;
    }

    if (rmssd > 60) {
      score += 12;
    } else if (rmssd > 40) {
      score += 6;
    } else if (rmssd < 20) {
      score -= 10;
    }

    if (age < 30) {
      score += 8;
    } else if (age < 40) {
      score += 4;
    } else if (age > 70) {
      score -= 10;
    } else if (age > 60) {
      score -= 5;
    }

    score += recoveryBase * 0.15;
    return PhysiologicalBounds.clamp(score, 10, 95);
  }

  static String fitnessCategory(double fitness) {
    if (fitness > 80) return "Excellent";
    if (fitness > 65) return "Good";
    if (fitness > 45) return "Fair";
    if (fitness > 30) return "Below Average";
    return "Needs Improvement";
  }

  static double vo2max(double age, double restingHr, double maxHr, double hrReserve,
      double fitness) {
    double value = 15.3 * (maxHr / restingHr)
        + fitness * 0.35
        + Math.max(0, (35 - age) * 0.25)
        + hrReserve * 0.08;
    return PhysiologicalBounds.clamp(value, 15, 75);
  }

  static double cardiovascularAge(double age, double fitness, double restingHr, double hrr1,
      double rmssd) {
    double cvAge = age + (fitness - 50) * -0.4;

    if (hrr1 > 30) {
      cvAge -= 7;
    } else if (hrr1 > 25) {
      cvAge -= 4;
    } else if (hrr1 > 20) {
      cvAge -= 2;
    } else if (hrr1 < 12) {
      cvAge += 10;
    } else if (hrr1 < 15) {
      cvAge += 5;
    }

    if (restingHr < 55) {
      cvAge -= 4;
    } else if (restingHr < 60) {
      cvAge -= 2;
    } else if (restingHr > 85) {
      cvAge += 6;
    } else if (restingHr > 75) {
      cvAge += 3;
    }

    if (rmssd > 50) {
      cvAge -= 3;
    } else if (rmssd > 35) {
      cvAge -= 1;
    } else if (rmssd < 20) {
      cvAge += 4;
    }
    return PhysiologicalBounds.clamp(cvAge, 18, 90);
  }

  static String ageComparison(double difference) {
    int years = (int) Math.abs(difference);
    if (difference < -2) return years + " years younger";
    if (difference > 2) return years + " years older";
    return "Age appropriate";
  }

  static double recoveryEfficiency(double hrr1, double hrr2, double timeToTarget) {
    double efficiency = Math.min(hrr1 / 30 * 50, 50)
        + Math.min(hrr2 / 50 * 30, 30)
        + Math.max(0, (180 - timeToTarget) / 180 * 20);
    return PhysiologicalBounds.clamp(efficiency, 0, 100);
  }

  static String recoveryStatus(double efficiency) {
    if (efficiency > 85) return "Excellent Recovery";
    if (efficiency > 70) return "Very Good Recovery";
    if (efficiency > 55) return "Good Recovery";
    if (efficiency > 40) return "Fair Recovery";
    if (efficiency > 25) return "Below Average Recovery";
    return "Poor Recovery";
  }

  static double trainingReadiness(double rmssd, double restingHr, double baseline, double sleep) {
    double score = 50d;

    if (rmssd > 60) {
      score += 25;
    } else if (rmssd > 45) {
      score += 15;
    } else if (rmssd > 30) {
      score += 8;
    } else if (rmssd < 20) {
      score -= 25;
    } else if (rmssd < 25) {
      score -= 10;
    }

    double elevation = restingHr - baseline;
    if (elevation < -2) {
      score += 10;
    } else if (elevation < 2) {
      score += 5;
    } else if (elevation > 10) {
      score -= 30;
    } else if (elevation > 5) {
      score -= 15;
    }

    score += (sleep - 0.5) * 40;
    return PhysiologicalBounds.clamp(score, 0, 100);
  }

  static String readinessStatus(double readiness) {
    if (readiness > 85) return "Peak Performance Ready";
    if (readiness > 70) return "Ready for High Intensity";
    if (readiness > 55) return "Ready for Moderate Activity";
    if (readiness > 40) return "Light Activity Recommended";
    if (readiness > 25) return "Recovery Priority";
    return "Rest Required";
  }

  static String recommendation(double fitness, double recovery, double readiness) {
    List<String> parts = new ArrayList<>();
    if (fitness < 40) {
      parts.add("Focus on building aerobic base with 30-min daily walks");
    } else if (fitness < 60) {
      parts.add("Add 2-3 cardio sessions per week to improve fitness");
    } else if (fitness > 75) {
      parts.add("Maintain excellence with varied training intensities");
    }

    if (recovery < 50) {
      parts.add("Prioritize recovery with proper sleep and nutrition");
    } else if (recovery > 70) {
      parts.add("Recovery is strong, you can increase training volume");
    }

    if (readiness < 40) {
      parts.add("Take a rest day or do light recovery activities");
    } else if (readiness > 70) {
      parts.add("Perfect timing for challenging workouts");
    }

    if (parts.isEmpty()) {
      return "Keep your current routine";
    }
    return String.join(". ", parts);
  }
}
