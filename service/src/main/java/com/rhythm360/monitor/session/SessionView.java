package com.rhythm360.monitor.session;

import com.rhythm360.monitor.alert.AlertStatus;
import com.rhythm360.monitor.assessment.AssessmentReport;
import com.rhythm360.monitor.zone.Zone;
import java.time.Instant;

public record SessionView(
    String deviceId,
    boolean active,
    Double currentValue,
    Instant lastSampleAt,
    Zone zone,
    AlertStatus alertStatus,
    Instant lastNotifiedAt,
    int bufferSize,
    int windowSize,
    long droppedSamples,
    AssessmentReport latestReport
) {}
