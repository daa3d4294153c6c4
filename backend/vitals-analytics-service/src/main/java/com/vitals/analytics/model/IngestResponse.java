package com.vitals.analytics.model;

public record IngestResponse(String status, String message) {
  public static IngestResponse ok() {
    return new IngestResponse("ok", "Metric ingested successfully");
  }
}
