package com.rhythm360.monitor.web;

import com.rhythm360.monitor.ingest.ActivityMode;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/** One pushed reading. A missing timestamp means "now", a missing mode means resting. */
public record SamplePayload(@NotNull Double value, Instant timestamp, ActivityMode mode) {}
