package com.rhythm360.monitor.ingest;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class SampleValidatorTest {

  @Test
  void acceptsInclusiveRange() {
    assertTrue(SampleValidator.isValid(20));
    assertTrue(SampleValidator.isValid(300));
    assertTrue(SampleValidator.isValid(72.5));
  }

  @Test
  void rejectsImpossibleValues() {
    assertFalse(SampleValidator.isValid(19.9));
    assertFalse(SampleValidator.isValid(300.1));
    assertFalse(SampleValidator.isValid(-5));
    assertFalse(SampleValidator.isValid(Double.NaN));
    assertFalse(SampleValidator.isValid(Double.POSITIVE_INFINITY));
  }

  @Test
  void rejectsNullSample() {
    assertFalse(SampleValidator.isValid((Sample) null));
    assertTrue(SampleValidator.isValid(new Sample(60, Instant.now(), ActivityMode.RESTING)));
  }
}
