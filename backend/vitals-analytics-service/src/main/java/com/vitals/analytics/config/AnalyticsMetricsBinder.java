package com.vitals.analytics.config;

import com.vitals.analytics.engine.AnalyticsEngine;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.stereotype.Component;

/**
 * Exposes engine state to the registry. Values are read from the engine when scraped;
 * the engine itself never pushes.
 */
@Component
public class AnalyticsMetricsBinder implements MeterBinder {

  private final AnalyticsEngine engine;

  public AnalyticsMetricsBinder(AnalyticsEngine engine) {
    this.engine = engine;
  }

  @Override
  public void bindTo(MeterRegistry registry) {
    FunctionCounter.builder("service_anomalies_total", engine, AnalyticsEngine::anomalyCount)
        .description("Total number of detected anomalies")
        .register(registry);
    Gauge.builder("service_anomaly_rate", engine, AnalyticsEngine::anomalyRate)
        .description("Current anomaly rate")
        .register(registry);
    Gauge.builder("service_prediction_value", engine, AnalyticsEngine::prediction)
        .description("Predicted value using rolling average")
        .register(registry);
  }
}
