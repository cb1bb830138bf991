package com.rhythm360.monitor.scoring;

public enum CriticalCondition {
  HIGH_RESTING_HEART_RATE(
      "Dangerously high resting heart rate detected. Seek immediate medical attention."),
  LOW_HEART_RATE(
      "Dangerously low heart rate detected. Seek immediate medical attention."),
  ABNORMAL_RESPIRATORY_RATE(
      "Abnormal respiratory rate detected. Consider medical consultation."),
  LOW_HRV_ELEVATED_HEART_RATE(
      "Very low heart rate variability with elevated heart rate. Medical evaluation recommended.");

  private final String message;

  CriticalCondition(String message) {
    this.message = message;
  }

  public String message() {
    return message;
  }
}
