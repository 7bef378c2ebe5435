package com.gentoro.jobhook.jobs;

import java.time.Instant;

/** Decides which terminal jobs may be dropped from the store. */
@FunctionalInterface
public interface JobRetentionPolicy {
  boolean shouldEvict(JobRecord record, Instant now);

  /** Keeps everything. */
  JobRetentionPolicy RETAIN_ALL = (record, now) -> false;
}
