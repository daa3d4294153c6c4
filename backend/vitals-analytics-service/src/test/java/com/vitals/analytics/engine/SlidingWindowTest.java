package com.vitals.analytics.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SlidingWindowTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  @Test
  @DisplayName("Evicts the oldest sample once capacity is reached")
  void evictsOldestFirst() {
    SlidingWindow window = new SlidingWindow(3);
    for (int i = 1; i <= 5; i++) window.push(i, T0.plusSeconds(i));

    assertThat(window.size()).isEqualTo(3);
    assertThat(window.isFull()).isTrue();
    assertThat(window.values()).containsExactly(3.0, 4.0, 5.0);
  }

  @Test
  @DisplayName("Not full until capacity samples have been pushed")
  void fillsUp() {
    SlidingWindow window = new SlidingWindow(3);
    window.push(1.0, T0);
    window.push(2.0, T0);

    assertThat(window.isFull()).isFalse();
    assertThat(window.values()).containsExactly(1.0, 2.0);
  }

  @Test
  @DisplayName("values() is a detached read-only copy")
  void valuesIsACopy() {
    SlidingWindow window = new SlidingWindow(2);
    window.push(1.0, T0);
    var before = window.values();
    window.push(2.0, T0);

    assertThat(before).containsExactly(1.0);
    assertThatThrownBy(() -> before.add(9.0)).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  @DisplayName("Sum and squared deviations cover exactly the current contents")
  void aggregates() {
    SlidingWindow window = new SlidingWindow(4);
    for (double v : new double[] {2, 4, 4, 4, 5}) window.push(v, T0);
    // window = [4, 4, 4, 5]
    assertThat(window.sum()).isEqualTo(17.0);
    assertThat(window.sumOfSquaredDeviations(4.25)).isCloseTo(0.75, within(1e-12));
  }

  @Test
  @DisplayName("Rejects a non-positive capacity")
  void rejectsBadCapacity() {
    assertThatThrownBy(() -> new SlidingWindow(0)).isInstanceOf(IllegalArgumentException.class);
  }
}
