package com.rhythm360.monitor.sensor;

/** Handle returned by {@link SensorGateway#subscribe}; closing it twice is harmless. */
public interface SensorSubscription extends AutoCloseable {
  @Override
  void close();
}
