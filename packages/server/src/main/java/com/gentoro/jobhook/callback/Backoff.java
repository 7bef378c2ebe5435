package com.gentoro.jobhook.callback;

import java.time.Duration;

/** Exponential backoff: {@code base * 2^(attempt-1)}, capped at {@code max}. */
record Backoff(Duration base, Duration max) {

  Duration delayAfter(int attempt) {
    if (attempt < 1 || base.isZero()) return Duration.ZERO;
    int shift = Math.min(attempt - 1, 62);
    long baseMillis = base.toMillis();
    // compare before shifting so the doubling can never overflow
    if (baseMillis > (max.toMillis() >> shift)) {
      return max;
    }
    return Duration.ofMillis(baseMillis << shift);
  }
}
