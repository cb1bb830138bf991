package com.rhythm360.monitor.scoring;

public record FitnessOutput(
    double fitnessLevel,
    String category,
    double vo2max,
    double cardiovascularAge,
    String ageComparison,
    double recoveryEfficiency,
    String recoveryStatus,
    double trainingReadiness,
    String readinessStatus,
    String recommendation
) {}
