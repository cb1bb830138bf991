package com.rhythm360.monitor.assessment;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;

public enum RiskTrend {
  IMPROVING,
  STABLE,
  WORSENING;

  static final int RECENT_COUNT = 3;
  static final double MARGIN = 0.2;

  @JsonValue
  public String jsonValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Compares the share of high-risk labels among the three newest records with the share among
   * the older ones. Fewer than two records is always stable.
   */
  public static RiskTrend from(List<String> riskLevelsNewestFirst) {
    int n = riskLevelsNewestFirst.size();
    if (n < 2) return STABLE;
    int split = Math.min(RECENT_COUNT, n);
    double recent = highShare(riskLevelsNewestFirst.subList(0, split));
    double older = highShare(riskLevelsNewestFirst.subList(split, n));
    if (recent > older + MARGIN) return WORSENING;
    if (recent < older - MARGIN) return IMPROVING;
    return STABLE;
  }

  private static double highShare(List<String> levels) {
    if (levels.isEmpty()) return 0d;
    long high = levels.stream().filter("High"::equals).count();
    return (double) high / levels.size();
  }
}
