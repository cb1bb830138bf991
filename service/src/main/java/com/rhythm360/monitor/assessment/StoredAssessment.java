package com.rhythm360.monitor.assessment;

import java.time.Instant;
import java.util.UUID;

public record StoredAssessment(
    UUID id,
    String deviceId,
    Instant recordedAt,
    double heartRate,
    double hrvMean,
    double respiratoryRate,
    double activityLevel,
    double sleepQuality,
    String rhythmStatus,
    double rhythmConfidence,
    String riskLevel,
    double riskConfidence,
    String hrvPattern,
    double patternConfidence,
    String overallStatus,
    Double fitnessLevel,
    String fitnessCategory,
    String readinessStatus
) {

  public static StoredAssessment from(AssessmentRecord r) {
    return new StoredAssessment(r.getId(), r.getDeviceId(), r.getRecordedAt(), r.getHeartRate(),
        r.getHrvMean(), r.getRespiratoryRate(), r.getActivityLevel(), r.getSleepQuality(),
        r.getRhythmStatus(), r.getRhythmConfidence(), r.getRiskLevel(), r.getRiskConfidence(),
        r.getHrvPattern(), r.getPatternConfidence(), r.getOverallStatus(), r.getFitnessLevel(),
        r.getFitnessCategory(), r.getReadinessStatus());
  }
}
