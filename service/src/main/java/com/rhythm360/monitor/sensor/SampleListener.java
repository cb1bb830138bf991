package com.rhythm360.monitor.sensor;

import com.rhythm360.monitor.ingest.ActivityMode;
import java.time.Instant;

@FunctionalInterface
public interface SampleListener {
  void onSample(double value, Instant timestamp, ActivityMode mode);
}
