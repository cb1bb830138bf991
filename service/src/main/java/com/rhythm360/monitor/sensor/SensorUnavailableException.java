package com.rhythm360.monitor.sensor;

public class SensorUnavailableException extends RuntimeException {
  private final String deviceId;

  public SensorUnavailableException(String deviceId, String message) {
    super(message);
    this.deviceId = deviceId;
  }

  public String deviceId() {
    return deviceId;
  }
}
