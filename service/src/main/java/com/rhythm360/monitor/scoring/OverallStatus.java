package com.rhythm360.monitor.scoring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OverallStatus {
  HEALTHY("Healthy"),
  MONITOR("Monitor"),
  NEEDS_ATTENTION("Needs Attention");

  private final String displayName;

  OverallStatus(String displayName) {
    this.displayName = displayName;
  }

  @JsonValue
  public String displayName() {
    return displayName;
  }

  @JsonCreator
  public static OverallStatus fromDisplayName(String value) {
    for (OverallStatus status : values()) {
      if (status.displayName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown overall status: " + value);
  }
}
