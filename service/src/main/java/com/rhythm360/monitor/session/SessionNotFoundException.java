package com.rhythm360.monitor.session;

public class SessionNotFoundException extends RuntimeException {
  public SessionNotFoundException(String deviceId) {
    super("No active monitoring session for device " + deviceId);
  }
}
