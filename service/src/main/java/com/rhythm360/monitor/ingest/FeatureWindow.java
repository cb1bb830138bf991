package com.rhythm360.monitor.ingest;

import java.util.Arrays;

/**
 * Longer-horizon window of raw values used for windowed statistics. Sized and evicted
 * independently of the {@link RingBuffer} fed by the same stream.
 */
public final class FeatureWindow {
  private final double[] values;
  private int head;
  private int size;

  public FeatureWindow(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
    }
    this.values = new double[capacity];
  }

  public void push(double value) {
    values[(head + size) % values.length] = value;
    if (size == values.length) {
      head = (head + 1) % values.length;
    } else {
      size++;
    }
  }

  public double[] recent(int n) {
    int count = Math.max(0, Math.min(n, size));
    double[] out = new double[count];
    int offset = size - count;
    for (int i = 0; i < count; i++) {
      out[i] = values[(head + offset + i) % values.length];
    }
    return out;
  }

  public double[] values() {
    return recent(size);
  }

  public int size() {
    return size;
  }

  public int capacity() {
    return values.length;
  }

  public void clear() {
    Arrays.fill(values, 0d);
    head = 0;
    size = 0;
  }
}
