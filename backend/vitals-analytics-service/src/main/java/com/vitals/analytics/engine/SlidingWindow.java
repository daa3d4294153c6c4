package com.vitals.analytics.engine;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-capacity FIFO of the most recent samples.
 *
 * <p>Not thread-safe. The owning {@link AnalyticsEngine} guards every access with its lock.
 */
final class SlidingWindow {

  private final int capacity;
  private final Deque<Sample> samples;

  SlidingWindow(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Window capacity must be >= 1, got " + capacity);
    }
    this.capacity = capacity;
    this.samples = new ArrayDeque<>(capacity);
  }

  void push(double value, Instant arrivedAt) {
    if (samples.size() == capacity) {
      samples.pollFirst();
    }
    samples.addLast(new Sample(value, arrivedAt));
  }

  /** Current contents, oldest first. */
  List<Double> values() {
    List<Double> out = new ArrayList<>(samples.size());
    for (Sample s : samples) out.add(s.value());
    return Collections.unmodifiableList(out);
  }

  double sum() {
    double sum = 0.0;
    for (Sample s : samples) sum += s.value();
    return sum;
  }

  double sumOfSquaredDeviations(double mean) {
    double acc = 0.0;
    for (Sample s : samples) {
      double d = s.value() - mean;
      acc += d * d;
    }
    return acc;
  }

  int size() { return samples.size(); }
  int capacity() { return capacity; }
  boolean isFull() { return samples.size() == capacity; }
}
