package com.rhythm360.monitor.web;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

public record StartSessionRequest(
    @DecimalMin("100") @DecimalMax("230") Double estimatedMaxHr
) {}
