package com.rhythm360.monitor.ingest;

import java.time.Instant;

// Arrival order is kept as-is; timestamps are never used to reorder.
public record Sample(double value, Instant timestamp, ActivityMode mode) {

  public boolean exercising() {
    return mode == ActivityMode.EXERCISE;
  }
}
