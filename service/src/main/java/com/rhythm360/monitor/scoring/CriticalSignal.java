package com.rhythm360.monitor.scoring;

public record CriticalSignal(CriticalCondition condition, String message) {

  public static CriticalSignal of(CriticalCondition condition) {
    return new CriticalSignal(condition, condition.message());
  }
}
