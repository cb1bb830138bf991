package com.rhythm360.monitor.notify;

public enum NotificationUrgency {
  LOW,
  MEDIUM,
  HIGH
}
