package com.vitals.analytics.engine;

import java.util.List;

/** Point-in-time copy of the engine state, as produced by one completed ingestion. */
public record AnalyticsSnapshot(
    double prediction,
    int windowSize,
    long totalMetrics,
    long anomalyCount,
    double anomalyRate,
    double mean,
    double stdDev,
    List<Double> currentWindow
) {
  public AnalyticsSnapshot {
    currentWindow = List.copyOf(currentWindow);
  }
}
