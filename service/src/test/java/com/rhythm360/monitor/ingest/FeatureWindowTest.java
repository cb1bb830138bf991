package com.rhythm360.monitor.ingest;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class FeatureWindowTest {

  @Test
  void evictsIndependentlyOfRingBuffer() {
    var ring = new RingBuffer<Double>(200);
    var window = new FeatureWindow(300);
    for (int i = 0; i < 500; i++) {
      ring.push((double) i);
      window.push(i);
    }
    assertEquals(200, ring.size());
    assertEquals(300, window.size());
    assertEquals(300d, ring.values().get(0));
    assertEquals(200d, window.values()[0]);
    assertEquals(499d, window.values()[299]);
  }

  @Test
  void recentReturnsNewestValuesOldestFirst() {
    var window = new FeatureWindow(5);
    for (int i = 1; i <= 7; i++) {
      window.push(i * 10);
    }
    assertArrayEquals(new double[] {50, 60, 70}, window.recent(3));
    assertArrayEquals(new double[] {30, 40, 50, 60, 70}, window.recent(99));
  }

  @Test
  void clearResetsSize() {
    var window = new FeatureWindow(3);
    window.push(1);
    window.push(2);
    window.clear();
    assertEquals(0, window.size());
    assertEquals(3, window.capacity());
    assertEquals(0, window.values().length);
  }
}
