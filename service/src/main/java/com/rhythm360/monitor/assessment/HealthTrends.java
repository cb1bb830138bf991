package com.rhythm360.monitor.assessment;

public record HealthTrends(
    int days,
    double averageHeartRate,
    double averageHrv,
    double averageRespiratoryRate,
    double totalActivity,
    double averageSleepQuality,
    RiskTrend riskTrend,
    long recordCount
) {

  public static HealthTrends empty(int days) {
    return new HealthTrends(days, 0, 0, 0, 0, 0, RiskTrend.STABLE, 0);
  }
}
