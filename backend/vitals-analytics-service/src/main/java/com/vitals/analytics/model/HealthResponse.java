package com.vitals.analytics.model;

public record HealthResponse(String status, String redis) {
  public static HealthResponse healthy() { return new HealthResponse("healthy", "connected"); }
  public static HealthResponse unhealthy() { return new HealthResponse("unhealthy", "disconnected"); }
}
