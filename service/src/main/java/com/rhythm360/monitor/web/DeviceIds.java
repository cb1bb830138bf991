package com.rhythm360.monitor.web;

final class DeviceIds {
  static final String REGEX = "^[A-Za-z0-9_.:-]{1,64}$";

  private DeviceIds() {
  }
}
