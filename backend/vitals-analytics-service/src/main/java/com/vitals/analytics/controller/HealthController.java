package com.vitals.analytics.controller;

import com.vitals.analytics.model.HealthResponse;
import com.vitals.analytics.repo.MetricCacheRepository;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

  private final MetricCacheRepository cache;

  public HealthController(MetricCacheRepository cache) {
    this.cache = cache;
  }

  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    if (cache.ping()) {
      return ResponseEntity.ok(HealthResponse.healthy());
    }
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(HealthResponse.unhealthy());
  }
}
