package com.vitals.analytics.model;

/**
 * One submitted performance sample. {@code timestamp} is epoch seconds; 0 means "not provided".
 */
public record Metric(
    long timestamp,
    double cpu,
    double rps
) {
  public Metric withTimestamp(long epochSeconds) {
    return new Metric(epochSeconds, cpu, rps);
  }
}
