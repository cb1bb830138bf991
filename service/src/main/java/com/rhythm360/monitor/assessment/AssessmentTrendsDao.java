package com.rhythm360.monitor.assessment;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class AssessmentTrendsDao {
  private final JdbcTemplate jdbc;
  private final Clock clock;

  public AssessmentTrendsDao(JdbcTemplate jdbc, Clock clock) {
    this.jdbc = jdbc;
    this.clock = clock;
  }

  public HealthTrends trends(int days) {
    Timestamp since = Timestamp.from(clock.instant().minus(Duration.ofDays(days)));
    String aggregateSql = """
      SELECT COUNT(*), AVG(heart_rate), AVG(hrv_mean), AVG(respiratory_rate),
             SUM(activity_level), AVG(sleep_quality)
      FROM assessment_records
      WHERE recorded_at >= ?
    """;
    HealthTrends totals = jdbc.queryForObject(aggregateSql, (rs, i) -> {
      long count = rs.getLong(1);
      if (count == 0) return HealthTrends.empty(days);
      return new HealthTrends(days, rs.getDouble(2), rs.getDouble(3), rs.getDouble(4),
          rs.getDouble(5), rs.getDouble(6), RiskTrend.STABLE, count);
    }, since);
    if (totals == null || totals.recordCount() == 0) {
      return HealthTrends.empty(days);
    }

    String riskSql = """
      SELECT risk_level
      FROM assessment_records
      WHERE recorded_at >= ?
      ORDER BY recorded_at DESC
    """;
    List<String> levels = jdbc.queryForList(riskSql, String.class, since);
    return new HealthTrends(days, totals.averageHeartRate(), totals.averageHrv(),
        totals.averageRespiratoryRate(), totals.totalActivity(), totals.averageSleepQuality(),
        RiskTrend.from(levels), totals.recordCount());
  }
}
