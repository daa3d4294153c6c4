package com.vitals.analytics.controller;

import com.vitals.analytics.engine.AnalyticsSnapshot;
import com.vitals.analytics.model.ErrorResponse;
import com.vitals.analytics.model.IngestResponse;
import com.vitals.analytics.model.Metric;
import com.vitals.analytics.service.InvalidMetricException;
import com.vitals.analytics.service.MetricIngestionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MetricsController {

  private final MetricIngestionService ingestion;

  public MetricsController(MetricIngestionService ingestion) {
    this.ingestion = ingestion;
  }

  @PostMapping("/metrics")
  public IngestResponse ingest(@RequestBody Metric metric) {
    ingestion.ingest(metric);
    return IngestResponse.ok();
  }

  @GetMapping("/analyze")
  public AnalyticsSnapshot analyze() {
    return ingestion.snapshot();
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> unreadable(HttpMessageNotReadableException e) {
    ingestion.recordMalformed();
    Throwable cause = e.getMostSpecificCause();
    String message = cause.getMessage() != null ? cause.getMessage() : e.getMessage();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse(message));
  }

  @ExceptionHandler(InvalidMetricException.class)
  public ResponseEntity<ErrorResponse> invalid(InvalidMetricException e) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse(e.getMessage()));
  }
}
