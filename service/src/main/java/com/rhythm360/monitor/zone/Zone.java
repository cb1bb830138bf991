package com.rhythm360.monitor.zone;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Zone {
  LOW("Low", 0),
  RESTING("Resting", 1),
  NORMAL("Normal", 2),
  ELEVATED("Elevated", 3),
  HIGH("High", 4),
  WARMUP("Warm Up", 2),
  FAT_BURN("Fat Burn", 3),
  CARDIO("Cardio", 4),
  PEAK("Peak", 5),
  MAXIMUM("Maximum", 6);

  private final String displayName;
  private final int intensity;

  Zone(String displayName, int intensity) {
    this.displayName = displayName;
    this.intensity = intensity;
  }

  @JsonValue
  public String displayName() {
    return displayName;
  }

  /** Rank used to order zones of the same mode; grows with the reading. */
  public int intensity() {
    return intensity;
  }
}
