package com.rhythm360.monitor.analysis;

public record WindowFeatures(double mean, double stdDev, double pnn50, int sampleCount) {}
