package com.rhythm360.monitor.ingest;

public enum ActivityMode {
  RESTING,
  EXERCISE
}
