package com.rhythm360.monitor.sensor;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

/** Partial aggregate update; null fields leave the previous reading in place. */
@Schema(description = "Ancillary readings pushed alongside the heart-rate stream")
public record SensorAggregates(
    @DecimalMin("0") @DecimalMax("100") Double respiratoryRate,
    @DecimalMin("0") Double activityEnergy,
    @DecimalMin("0") @DecimalMax("1") Double sleepRatio,
    @DecimalMin("0") @DecimalMax("500") Double hrv
) {}
