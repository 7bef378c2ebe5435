package com.gentoro.jobhook.jobs;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Evicts terminal jobs whose last update is older than a fixed age. Jobs still waiting on
 * callback delivery are kept.
 */
public final class TerminalAgeRetentionPolicy implements JobRetentionPolicy {
  private final Duration maxAge;

  public TerminalAgeRetentionPolicy(Duration maxAge) {
    this.maxAge = Objects.requireNonNull(maxAge, "maxAge");
  }

  @Override
  public boolean shouldEvict(JobRecord record, Instant now) {
    return record.isTerminal()
        && record.deliveryStatus() != DeliveryStatus.PENDING
        && record.updatedAt().plus(maxAge).isBefore(now);
  }
}
