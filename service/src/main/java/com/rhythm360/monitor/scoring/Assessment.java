package com.rhythm360.monitor.scoring;

import java.time.Instant;
import java.util.UUID;

/** Result of one scoring cycle. Superseded, never mutated, by the next cycle. */
public record Assessment(
    UUID id,
    ModelOutput rhythm,
    ModelOutput risk,
    ModelOutput pattern,
    FitnessOutput fitness,
    OverallStatus overallStatus,
    Instant timestamp
) {}
