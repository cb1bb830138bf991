package com.rhythm360.monitor.alert;

public enum AlertStatus {
  NORMAL,
  MONITORING,
  WARNING,
  CRITICAL
}
