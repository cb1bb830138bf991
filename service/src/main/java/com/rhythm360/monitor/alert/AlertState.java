package com.rhythm360.monitor.alert;

import java.time.Instant;

public record AlertState(AlertStatus status, Instant lastNotifiedAt) {

  public static AlertState initial() {
    return new AlertState(AlertStatus.NORMAL, null);
  }
}
