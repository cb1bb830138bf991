package com.rhythm360.monitor.scoring;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class CriticalPreCheckTest {

  private static HealthSnapshot snapshot(double hr, double hrv, double resp, double activity) {
    return new HealthSnapshot(hr, 3, 0.2, hrv, resp, activity, 0.8, List.of(hr, hr));
  }

  @Test
  void reportsEveryTriggeredConditionInOrder() {
    var signals = CriticalPreCheck.check(snapshot(160, 5, 30, 50));
    assertEquals(List.of(
        CriticalCondition.HIGH_RESTING_HEART_RATE,
        CriticalCondition.ABNORMAL_RESPIRATORY_RATE,
        CriticalCondition.LOW_HRV_ELEVATED_HEART_RATE),
        signals.stream().map(CriticalSignal::condition).toList());
    assertTrue(signals.get(0).message().startsWith("Dangerously high resting heart rate"));
  }

  @Test
  void lowHeartRateAlone() {
    var signals = CriticalPreCheck.check(snapshot(35, 50, 16, 250));
    assertEquals(1, signals.size());
    assertEquals(CriticalCondition.LOW_HEART_RATE, signals.get(0).condition());
  }

  @Test
  void highRateDuringActivityIsNotCritical() {
    assertTrue(CriticalPreCheck.check(snapshot(160, 50, 16, 400)).isEmpty());
  }

  @Test
  void respiratoryBoundsAreInclusive() {
    assertTrue(CriticalPreCheck.check(snapshot(70, 50, 8, 250)).isEmpty());
    assertTrue(CriticalPreCheck.check(snapshot(70, 50, 25, 250)).isEmpty());
    assertEquals(1, CriticalPreCheck.check(snapshot(70, 50, 7.9, 250)).size());
  }

  @Test
  void heartRateConditionsNeedBufferedHeartRates() {
    var empty = HealthSnapshot.of(new double[0], 5, 16, 50, 0.8);
    assertTrue(CriticalPreCheck.check(empty).isEmpty());

    var breathless = HealthSnapshot.of(new double[0], 50, 30, 250, 0.8);
    assertEquals(List.of(CriticalCondition.ABNORMAL_RESPIRATORY_RATE),
        CriticalPreCheck.check(breathless).stream().map(CriticalSignal::condition).toList());
  }
}
