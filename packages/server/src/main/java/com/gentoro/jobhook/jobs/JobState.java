package com.gentoro.jobhook.jobs;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a webhook job.
 *
 * <p>{@code RECEIVED}, {@code VALIDATING} and {@code REJECTED} only exist for the duration of the
 * inbound request; records are created in the store at {@code ACCEPTED}.
 */
public enum JobState {
  /** Request arrived, signature not yet checked. */
  RECEIVED,
  /** Signature accepted, payload being parsed and validated. */
  VALIDATING,
  /** Signature or payload rejected. */
  REJECTED,
  /** Analysis running. */
  EXECUTING,
  /** Async request acknowledged and background execution scheduled. */
  ACCEPTED,
  /** Analysis produced a result. */
  SUCCEEDED,
  /** Analysis failed permanently. */
  FAILED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == REJECTED;
  }

  public boolean canTransitionTo(JobState next) {
    return successors().contains(next);
  }

  private Set<JobState> successors() {
    return switch (this) {
      case RECEIVED -> EnumSet.of(VALIDATING, REJECTED);
      case VALIDATING -> EnumSet.of(REJECTED, EXECUTING, ACCEPTED);
      case ACCEPTED -> EnumSet.of(EXECUTING, FAILED);
      case EXECUTING -> EnumSet.of(SUCCEEDED, FAILED);
      case REJECTED, SUCCEEDED, FAILED -> EnumSet.noneOf(JobState.class);
    };
  }
}
