package com.vitals.analytics.service;

import com.vitals.analytics.engine.AnalyticsEngine;
import com.vitals.analytics.engine.AnalyticsSnapshot;
import com.vitals.analytics.model.Metric;
import com.vitals.analytics.repo.MetricCacheRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Front door for metric submissions: caches the raw record, then hands {@code rps} to the engine
 * on the bounded ingest pool so the HTTP thread never waits on the engine lock.
 */
@Service
public class MetricIngestionService {

  private static final Logger log = LoggerFactory.getLogger(MetricIngestionService.class);

  private final AnalyticsEngine engine;
  private final MetricCacheRepository cache;
  private final TaskExecutor ingestExecutor;
  private final Clock clock;
  private final MeterRegistry metrics;
  private final Counter accepted;
  private final Counter failed;
  private final Counter ingestRejected;
  private final Timer ingestLatency;
  private final Timer analyzeLatency;

  public MetricIngestionService(AnalyticsEngine engine,
                                MetricCacheRepository cache,
                                @Qualifier("ingestExecutor") TaskExecutor ingestExecutor,
                                Clock clock,
                                MeterRegistry metrics) {
    this.engine = engine;
    this.cache = cache;
    this.ingestExecutor = ingestExecutor;
    this.clock = clock;
    this.metrics = metrics;
    this.accepted = submissions("success", metrics);
    this.failed = submissions("error", metrics);
    this.ingestRejected = Counter.builder("service_ingest_rejected_total")
        .description("Samples accepted over HTTP that never reached the analytics engine")
        .register(metrics);
    this.ingestLatency = latency("ingest", metrics);
    this.analyzeLatency = latency("analyze", metrics);
  }

  private static Counter submissions(String status, MeterRegistry metrics) {
    return Counter.builder("service_rps_total")
        .description("Total requests per second")
        .tag("status", status)
        .register(metrics);
  }

  private static Timer latency(String endpoint, MeterRegistry metrics) {
    return Timer.builder("service_latency_seconds")
        .description("Request latency in seconds")
        .tag("endpoint", endpoint)
        .publishPercentileHistogram()
        .register(metrics);
  }

  /**
   * Caches the metric, filling in its timestamp when none was supplied, and schedules it for analysis.
   *
   * @throws InvalidMetricException if {@code rps} is not a finite number
   */
  public void ingest(Metric metric) {
    if (!Double.isFinite(metric.rps())) {
      failed.increment();
      throw new InvalidMetricException("rps must be a finite number, got " + metric.rps());
    }
    Timer.Sample sample = Timer.start(metrics);

    Metric stored = metric.timestamp() == 0
        ? metric.withTimestamp(clock.instant().getEpochSecond())
        : metric;
    cache.save(stored);

    double rps = stored.rps();
    try {
      ingestExecutor.execute(() -> analyze(rps));
    } catch (TaskRejectedException e) {
      ingestRejected.increment();
      log.warn("Ingest pool rejected sample rps={}: {}", rps, e.getMessage());
    }

    accepted.increment();
    sample.stop(ingestLatency);
  }

  /** Counts a submission that never reached {@link #ingest(Metric)}, e.g. an unreadable body. */
  public void recordMalformed() {
    failed.increment();
  }

  public AnalyticsSnapshot snapshot() {
    Timer.Sample sample = Timer.start(metrics);
    try {
      return engine.snapshot();
    } finally {
      sample.stop(analyzeLatency);
    }
  }

  void analyze(double rps) {
    try {
      engine.ingest(rps);
    } catch (IllegalArgumentException e) {
      ingestRejected.increment();
      log.warn("Engine rejected sample: {}", e.getMessage());
    }
  }
}
