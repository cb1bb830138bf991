package com.rhythm360.monitor.exports;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"Date", "Time", "HeartRate", "HRV", "RespiratoryRate", "Activity",
    "SleepQuality", "RiskLevel", "RhythmStatus", "PatternStatus"})
public record AssessmentCsvRow(
    @JsonProperty("Date") String date,
    @JsonProperty("Time") String time,
    @JsonProperty("HeartRate") int heartRate,
    @JsonProperty("HRV") int hrv,
    @JsonProperty("RespiratoryRate") int respiratoryRate,
    @JsonProperty("Activity") int activity,
    @JsonProperty("SleepQuality") String sleepQuality,
    @JsonProperty("RiskLevel") String riskLevel,
    @JsonProperty("RhythmStatus") String rhythmStatus,
    @JsonProperty("PatternStatus") String patternStatus
) {}
