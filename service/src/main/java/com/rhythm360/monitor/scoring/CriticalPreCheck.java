package com.rhythm360.monitor.scoring;

import java.util.ArrayList;
import java.util.List;

/**
 * Fast safety gate evaluated next to the ensemble on raw (unclamped) snapshot values. Every
 * triggered condition is returned, in a fixed order; an empty list means nothing critical.
 * Heart-rate conditions are only evaluated when the snapshot carries buffered heart rates.
 */
public final class CriticalPreCheck {
  private CriticalPreCheck() {
  }

  public static List<CriticalSignal> check(HealthSnapshot snapshot) {
    double hr = snapshot.meanHeartRate();
    double resp = snapshot.respiratoryRate();
    boolean hasHr = snapshot.hasHeartRateData();
    List<CriticalSignal> signals = new ArrayList<>(4);
    if (hasHr && hr > 150 && snapshot.activityLevel() < 100) {
      signals.add(CriticalSignal.of(CriticalCondition.HIGH_RESTING_HEART_RATE));
    }
    if (hasHr && hr < 40) {
      signals.add(CriticalSignal.of(CriticalCondition.LOW_HEART_RATE));
    }
    if (resp > 25 || resp < 8) {
      signals.add(CriticalSignal.of(CriticalCondition.ABNORMAL_RESPIRATORY_RATE));
    }
    if (hasHr && snapshot.hrvMean() < 10 && hr > 80) {
      signals.add(CriticalSignal.of(CriticalCondition.LOW_HRV_ELEVATED_HEART_RATE));
    }
    return List.copyOf(signals);
  }
}
