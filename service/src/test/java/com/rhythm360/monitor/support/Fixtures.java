package com.rhythm360.monitor.support;

import com.rhythm360.monitor.scoring.Assessment;
import com.rhythm360.monitor.scoring.FitnessProfile;
import com.rhythm360.monitor.scoring.HealthSnapshot;
import com.rhythm360.monitor.scoring.ScoringEnsemble;
import java.time.Instant;

public final class Fixtures {
  private Fixtures() {
  }

  public static HealthSnapshot restingSnapshot() {
    double[] rates = new double[30];
    for (int i = 0; i < rates.length; i++) {
      rates[i] = 66 + (i % 4);
    }
    return HealthSnapshot.of(rates, 52, 15, 320, 0.82);
  }

  public static Assessment assessment(HealthSnapshot snapshot, Instant at) {
    return new ScoringEnsemble(FitnessProfile.defaults()).assess(snapshot, at);
  }
}
