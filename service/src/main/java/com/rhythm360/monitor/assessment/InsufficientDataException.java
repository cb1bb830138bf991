package com.rhythm360.monitor.assessment;

/** Raised when an assessment is requested before any heart rate has been buffered. */
public class InsufficientDataException extends RuntimeException {
  private final String deviceId;

  public InsufficientDataException(String deviceId) {
    super("No heart-rate samples buffered for device " + deviceId + " yet");
    this.deviceId = deviceId;
  }

  public String deviceId() {
    return deviceId;
  }
}
