package com.vitals.analytics.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Streaming statistics over the last {@code N} accepted samples.
 *
 * <p>Every {@link #ingest(double)} recomputes the rolling-average prediction over the window. Once the window
 * has filled for the first time, it also recomputes the population mean and standard deviation and runs the
 * z-score classifier against the sample just pushed. The window never drains, so that gate stays open for the
 * life of the engine.
 *
 * <p>All state sits behind one read/write lock. Ingestion holds the write lock for O(N) work and nothing else;
 * the diagnostic log line for an anomaly is written after it is released. Concurrent callers get per-call
 * atomicity only: the window holds the last N values accepted here, not the last N submitted.
 */
public class AnalyticsEngine {

  private static final Logger log = LoggerFactory.getLogger(AnalyticsEngine.class);

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final SlidingWindow window;
  private final double zThreshold;
  private final Clock clock;

  // guarded by lock
  private double prediction;
  private double mean;
  private double stdDev;
  private long totalCount;
  private long anomalyCount;
  private double anomalyRate;

  public AnalyticsEngine(int windowSize, double zThreshold, Clock clock) {
    if (!Double.isFinite(zThreshold) || zThreshold < 0.0) {
      throw new IllegalArgumentException("z-score threshold must be finite and >= 0, got " + zThreshold);
    }
    this.window = new SlidingWindow(windowSize);
    this.zThreshold = zThreshold;
    this.clock = clock;
  }

  public AnalyticsEngine(int windowSize) {
    this(windowSize, AnomalyClassifier.DEFAULT_THRESHOLD, Clock.systemUTC());
  }

  /**
   * Accepts one sample.
   *
   * @throws IllegalArgumentException if {@code value} is NaN or infinite; engine state is left untouched
   */
  public void ingest(double value) {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException("Sample must be a finite number, got " + value);
    }
    Instant now = clock.instant();
    AnomalyReport report = null;

    lock.writeLock().lock();
    try {
      window.push(value, now);
      int n = window.size();
      prediction = window.sum() / n;

      if (window.isFull()) {
        mean = prediction;
        stdDev = Math.sqrt(window.sumOfSquaredDeviations(mean) / n);

        AnomalyClassifier.Classification c = AnomalyClassifier.classify(value, mean, stdDev, zThreshold);
        if (c.anomaly()) {
          anomalyCount++;
          report = new AnomalyReport(value, c.zScore(), mean, stdDev, now);
        }
      }

      totalCount++;
      anomalyRate = (double) anomalyCount / totalCount * 100;
    } finally {
      lock.writeLock().unlock();
    }

    if (report != null) {
      logAnomaly(report);
    }
  }

  public AnalyticsSnapshot snapshot() {
    lock.readLock().lock();
    try {
      return new AnalyticsSnapshot(
          prediction,
          window.size(),
          totalCount,
          anomalyCount,
          anomalyRate,
          mean,
          stdDev,
          window.values());
    } finally {
      lock.readLock().unlock();
    }
  }

  public double prediction() {
    return read(() -> prediction);
  }

  public double anomalyRate() {
    return read(() -> anomalyRate);
  }

  public long anomalyCount() {
    return read(() -> anomalyCount);
  }

  public long totalCount() {
    return read(() -> totalCount);
  }

  public int windowCapacity() {
    return window.capacity();
  }

  public double zThreshold() {
    return zThreshold;
  }

  private <T> T read(Supplier<T> field) {
    lock.readLock().lock();
    try {
      return field.get();
    } finally {
      lock.readLock().unlock();
    }
  }

  private void logAnomaly(AnomalyReport report) {
    log.warn("Anomaly detected: rps={} z={} mean={} stdDev={} at={}",
        String.format(Locale.ROOT, "%.2f", report.value()),
        String.format(Locale.ROOT, "%.2f", report.zScore()),
        String.format(Locale.ROOT, "%.2f", report.mean()),
        String.format(Locale.ROOT, "%.2f", report.stdDev()),
        report.detectedAt());
  }
}
