package com.rhythm360.monitor.session;

public class MonitoringConfigurationException extends RuntimeException {
  private final String deviceId;

  public MonitoringConfigurationException(String deviceId, String message, Throwable cause) {
    super(message, cause);
    this.deviceId = deviceId;
  }

  public String deviceId() {
    return deviceId;
  }
}
