package com.rhythm360.monitor.assessment;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class RiskTrendTest {

  @Test
  void tooFewRecordsAreStable() {
    assertEquals(RiskTrend.STABLE, RiskTrend.from(List.of()));
    assertEquals(RiskTrend.STABLE, RiskTrend.from(List.of("High")));
  }

  @Test
  void moreHighRiskRecentlyIsWorsening() {
    assertEquals(RiskTrend.WORSENING,
        RiskTrend.from(List.of("High", "High", "Low", "Low", "Low", "Medium")));
  }

  @Test
  void lessHighRiskRecentlyIsImproving() {
    assertEquals(RiskTrend.IMPROVING,
        RiskTrend.from(List.of("Low", "Low", "Medium", "High", "High", "High")));
  }

  @Test
  void smallDifferencesStayStable() {
    assertEquals(RiskTrend.STABLE,
        RiskTrend.from(List.of("High", "Low", "Low", "High", "Low", "Low")));
  }

  @Test
  void serializesLowercase() {
    assertEquals("worsening", RiskTrend.WORSENING.jsonValue());
  }
}
