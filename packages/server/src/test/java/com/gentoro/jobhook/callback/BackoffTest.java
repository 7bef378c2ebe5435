package com.gentoro.jobhook.callback;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class BackoffTest {

  @Test
  void doublesUntilCapped() {
    Backoff backoff = new Backoff(Duration.ofMillis(100), Duration.ofMillis(1000));
    assertEquals(Duration.ofMillis(100), backoff.delayAfter(1));
    assertEquals(Duration.ofMillis(200), backoff.delayAfter(2));
    assertEquals(Duration.ofMillis(400), backoff.delayAfter(3));
    assertEquals(Duration.ofMillis(800), backoff.delayAfter(4));
    assertEquals(Duration.ofMillis(1000), backoff.delayAfter(5));
    assertEquals(Duration.ofMillis(1000), backoff.delayAfter(64));
  }

  @Test
  void zeroBaseMeansNoDelay() {
    Backoff backoff = new Backoff(Duration.ZERO, Duration.ofSeconds(5));
    assertEquals(Duration.ZERO, backoff.delayAfter(3));
  }

  @Test
  void hugeBaseIsCappedInsteadOfWrappingAround() {
    Duration max = Duration.ofMillis(Long.MAX_VALUE);
    Backoff backoff = new Backoff(Duration.ofMillis(1L << 40), max);
    assertEquals(max, backoff.delayAfter(31));
    assertEquals(max, backoff.delayAfter(64));
    assertEquals(Duration.ofMillis(1L << 41), backoff.delayAfter(2));
  }
}
