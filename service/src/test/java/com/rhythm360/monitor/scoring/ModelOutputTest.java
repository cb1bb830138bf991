package com.rhythm360.monitor.scoring;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class ModelOutputTest {

  @Test
  void confidenceIsClamped() {
    assertEquals(1d, new ModelOutput("x", 1.7).confidence());
    assertEquals(0d, new ModelOutput("x", -0.2).confidence());
    assertEquals(0d, new ModelOutput("x", Double.NaN).confidence());
  }

  @Test
  void blankLabelIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new ModelOutput(" ", 0.5));
  }

  @Test
  void everyScorerStaysWithinBoundsOnExtremeInputs() {
    double[] extremes = {-1e9, -1, 0, 1e-6, 0.5, 29, 251, 1e9, Double.NaN,
        Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY};
    var random = new Random(11);
    List<ModelOutput> outputs = new ArrayList<>();
    for (int i = 0; i < 2000; i++) {
      double a = extremes[random.nextInt(extremes.length)];
      double b = extremes[random.nextInt(extremes.length)];
      double c = extremes[random.nextInt(extremes.length)];
      double d = extremes[random.nextInt(extremes.length)];
      double e = extremes[random.nextInt(extremes.length)];
      outputs.add(RhythmScorer.score(a, b, c));
      outputs.add(RiskScorer.score(a, b, c, d, e));
      outputs.add(PatternScorer.score(List.of(a, b, c, d, e, a, b)));
    }
    for (ModelOutput output : outputs) {
      assertTrue(output.confidence() >= 0d && output.confidence() <= 1d, output::toString);
    }
  }
}
