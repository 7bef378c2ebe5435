package com.gentoro.jobhook.jobs;

/** Callback delivery progress, tracked apart from the job's own lifecycle state. */
public enum DeliveryStatus {
  /** No callback URL was supplied. */
  NOT_REQUESTED,
  /** Callback is queued or being attempted. */
  PENDING,
  /** Receiver acknowledged with a 2xx status. */
  DELIVERED,
  /** Receiver never accepted the callback; retries used up or a permanent rejection. */
  EXHAUSTED
}
