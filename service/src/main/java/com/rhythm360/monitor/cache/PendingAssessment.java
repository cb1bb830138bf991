package com.rhythm360.monitor.cache;

import com.rhythm360.monitor.scoring.Assessment;
import com.rhythm360.monitor.scoring.HealthSnapshot;

public record PendingAssessment(String deviceId, Assessment assessment, HealthSnapshot snapshot) {}
