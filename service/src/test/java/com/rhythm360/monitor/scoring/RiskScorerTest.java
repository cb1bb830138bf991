package com.rhythm360.monitor.scoring;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class RiskScorerTest {

  @Test
  void poorRecoveryInactivityAndBreathingIsHigh() {
    var out = RiskScorer.score(95, 15, 22, 50, 0.4);
    assertEquals(RiskScorer.HIGH, out.label());
    assertEquals(0.95, out.confidence(), 1e-9);
  }

  @Test
  void restedActiveProfileIsLow() {
    var out = RiskScorer.score(65, 60, 14, 400, 0.9);
    assertEquals(RiskScorer.LOW, out.label());
    assertEquals(0.85, out.confidence(), 1e-9);
  }

  @Test
  void partialRecoveryWithLowActivityIsMedium() {
    // recovery 0.6 -> +0.2, activity < 100 -> +0.2
    var out = RiskScorer.score(70, 50, 16, 50, 0.6);
    assertEquals(RiskScorer.MEDIUM, out.label());
    assertEquals(0.775, out.confidence(), 1e-9);
  }

  @Test
  void respiratoryRateOutsideBandAddsRisk() {
    assertEquals(0.1, RiskScorer.riskScore(70, 80, 10, 500, 0.9), 1e-9);
    assertEquals(0.0, RiskScorer.riskScore(70, 80, 16, 500, 0.9), 1e-9);
  }
}
