package com.rhythm360.monitor.assessment;

import com.rhythm360.monitor.scoring.Assessment;
import com.rhythm360.monitor.scoring.FitnessOutput;
import com.rhythm360.monitor.scoring.HealthSnapshot;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "assessment_records")
public class AssessmentRecord {

  @Id
  private UUID id;

  @Column(name = "device_id", nullable = false)
  private String deviceId;

  @Column(name = "recorded_at", nullable = false)
  private Instant recordedAt;

  private double heartRate;
  private double stdHeartRate;
  private double pnn50;
  private double hrvMean;
  private double respiratoryRate;
  private double activityLevel;
  private double sleepQuality;

  private String rhythmStatus;
  private double rhythmConfidence;
  private String riskLevel;
  private double riskConfidence;
  private String hrvPattern;
  private double patternConfidence;
  private String overallStatus;

  private Double fitnessLevel;
  private String fitnessCategory;
  private Double vo2max;
  private Double cardiovascularAge;
  private String recoveryStatus;
  private Double trainingReadiness;
  private String readinessStatus;

  public AssessmentRecord() {
    // JPA default constructor
  }

  public static AssessmentRecord of(String deviceId, Assessment assessment,
      HealthSnapshot snapshot) {
    AssessmentRecord r = new AssessmentRecord();
    r.id = assessment.id();
    r.deviceId = deviceId;
    r.recordedAt = assessment.timestamp();
    r.heartRate = snapshot.meanHeartRate();
    r.stdHeartRate = snapshot.stdHeartRate();
    r.pnn50 = snapshot.pnn50();
    r.hrvMean = snapshot.hrvMean();
    r.respiratoryRate = snapshot.respiratoryRate();
    r.activityLevel = snapshot.activityLevel();
    r.sleepQuality = snapshot.sleepQuality();
    r.rhythmStatus = assessment.rhythm().label();
    r.rhythmConfidence = assessment.rhythm().confidence();
    r.riskLevel = assessment.risk().label();
    r.riskConfidence = assessment.risk().confidence();
    r.hrvPattern = assessment.pattern().label();
    r.patternConfidence = assessment.pattern().confidence();
    r.overallStatus = assessment.overallStatus().displayName();
    FitnessOutput fitness = assessment.fitness();
    if (fitness != null) {
      r.fitnessLevel = fitness.fitnessLevel();
      r.fitnessCategory = fitness.category();
      r.vo2max = fitness.vo2max();
      r.cardiovascularAge = fitness.cardiovascularAge();
      r.recoveryStatus = fitness.recoveryStatus();
      r.trainingReadiness = fitness.trainingReadiness();
      r.readinessStatus = fitness.readinessStatus();
    }
    return r;
  }

  public UUID getId() {
    return id;
  }

  public String getDeviceId() {
    return deviceId;
  }

  public Instant getRecordedAt() {
    return recordedAt;
  }

  public double getHeartRate() {
    return heartRate;
  }

  public double getStdHeartRate() {
    return stdHeartRate;
  }

  public double getPnn50() {
    return pnn50;
  }

  public double getHrvMean() {
    return hrvMean;
  }

  public double getRespiratoryRate() {
    return respiratoryRate;
  }

  public double getActivityLevel() {
    return activityLevel;
  }

  public double getSleepQuality() {
    return sleepQuality;
  }

  public String getRhythmStatus() {
    return rhythmStatus;
  }

  public double getRhythmConfidence() {
    return rhythmConfidence;
  }

  public String getRiskLevel() {
    return riskLevel;
  }

  public double getRiskConfidence() {
    return riskConfidence;
  }

  public String getHrvPattern() {
    return hrvPattern;
  }

  public double getPatternConfidence() {
    return patternConfidence;
  }

  public String getOverallStatus() {
    return overallStatus;
  }

  public Double getFitnessLevel() {
    return fitnessLevel;
  }

  public String getFitnessCategory() {
    return fitnessCategory;
  }

  public Double getVo2max() {
    return vo2max;
  }

  public Double getCardiovascularAge() {
    return cardiovascularAge;
  }

  public String getRecoveryStatus() {
    return recoveryStatus;
  }

  public Double getTrainingReadiness() {
    return trainingReadiness;
  }

  public String getReadinessStatus() {
    return readinessStatus;
  }
}
