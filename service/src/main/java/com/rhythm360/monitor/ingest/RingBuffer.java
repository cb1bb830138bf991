package com.rhythm360.monitor.ingest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fixed-capacity FIFO store backed by a circular array. Pushing into a full buffer evicts the
 * oldest entry. Not thread-safe; a buffer belongs to exactly one monitoring session.
 */
public final class RingBuffer<T> {
  private final Object[] slots;
  private int head;
  private int size;

  public RingBuffer(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
    }
    this.slots = new Object[capacity];
  }

  public void push(T item) {
    int tail = (head + size) % slots.length;
    slots[tail] = item;
    if (size == slots.length) {
      head = (head + 1) % slots.length;
    } else {
      size++;
    }
  }

  /** Last {@code n} entries, oldest first. {@code n} is clamped to the current size. */
  public List<T> recent(int n) {
    int count = Math.max(0, Math.min(n, size));
    List<T> out = new ArrayList<>(count);
    for (int i = size - count; i < size; i++) {
      out.add(get(i));
    }
    return out;
  }

  public List<T> values() {
    return recent(size);
  }

  public T latest() {
    return size == 0 ? null : get(size - 1);
  }

  @SuppressWarnings("unchecked")
  private T get(int logicalIndex) {
    return (T) slots[(head + logicalIndex) % slots.length];
  }

  public int size() {
    return size;
  }

  public int capacity() {
    return slots.length;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  public void clear() {
    Arrays.fill(slots, null);
    head = 0;
    size = 0;
  }
}
