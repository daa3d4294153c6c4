package com.vitals.analytics.engine;

import java.time.Instant;

/** Diagnostic record of one sample classified as anomalous. */
record AnomalyReport(
    double value,
    double zScore,
    double mean,
    double stdDev,
    Instant detectedAt
) {}
