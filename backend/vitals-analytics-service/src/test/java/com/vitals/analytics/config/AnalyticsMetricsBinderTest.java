package com.vitals.analytics.config;

import com.vitals.analytics.engine.AnalyticsEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AnalyticsMetricsBinderTest {

  @Test
  @DisplayName("Gauges and the anomaly counter sample live engine state")
  void samplesEngine() {
    AnalyticsEngine engine = new AnalyticsEngine(10);
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    new AnalyticsMetricsBinder(engine).bindTo(registry);

    assertThat(registry.get("service_prediction_value").gauge().value()).isZero();

    engine.ingest(11.0);
    for (int i = 0; i < 9; i++) engine.ingest(10.0);
    engine.ingest(50.0);

    assertThat(registry.get("service_anomalies_total").functionCounter().count()).isEqualTo(1.0);
    assertThat(registry.get("service_anomaly_rate").gauge().value()).isCloseTo(100.0 / 11, within(1e-9));
    assertThat(registry.get("service_prediction_value").gauge().value()).isCloseTo(14.0, within(1e-9));
  }
}
