package com.rhythm360.monitor.scoring;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class RhythmScorerTest {

  @Test
  void highDeviationWithLowPnn50IsIrregular() {
    var out = RhythmScorer.score(88, 18.5, 0.05);
    assertEquals(RhythmScorer.IRREGULAR, out.label());
    assertEquals(0.8, out.confidence(), 1e-9);
  }

  @Test
  void steadyTachycardiaReachesIrregularThreshold() {
    var out = RhythmScorer.score(165, 4.2, 0.05);
    assertEquals(RhythmScorer.IRREGULAR, out.label());
    assertEquals(0.5, out.confidence(), 1e-9);
  }

  @Test
  void calmRestingRhythmIsNormal() {
    var out = RhythmScorer.score(65, 5, 0.3);
    assertEquals(RhythmScorer.NORMAL, out.label());
    assertEquals(1.0, out.confidence(), 1e-9);
  }

  @Test
  void slowButSteadyRhythmStaysNormal() {
    var out = RhythmScorer.score(45, 5, 0.3);
    assertEquals(RhythmScorer.NORMAL, out.label());
    assertEquals(0.8, out.confidence(), 1e-9);
  }

  @Test
  void inputsAreClampedBeforeScoring() {
    // std 500 clamps to 100, pnn50 -1 clamps to 0, hr 400 clamps to 250
    assertEquals(1.0, RhythmScorer.irregularity(400, 500, -1), 1e-9);
    assertEquals(0.95, RhythmScorer.score(400, 500, -1).confidence(), 1e-9);
  }
}
