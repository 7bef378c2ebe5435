package com.gentoro.jobhook.jobs;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Keyed storage for job lifecycle state. Implementations must serialize writes per job id and
 * enforce {@link JobState#canTransitionTo(JobState)}.
 */
public interface JobStore {

  /**
   * Create a record in {@link JobState#ACCEPTED}.
   *
   * @throws com.gentoro.jobhook.exception.ConflictException if the id is already present
   */
  JobRecord create(String jobId, String url, String callbackUrl);

  /**
   * @throws com.gentoro.jobhook.exception.NotFoundException if the id is unknown
   */
  JobRecord get(String jobId);

  boolean exists(String jobId);

  /**
   * Move a job to {@code next}. {@code result} must accompany {@link JobState#SUCCEEDED} and
   * {@code error} must accompany {@link JobState#FAILED}; both must be absent otherwise.
   *
   * @throws com.gentoro.jobhook.exception.InvalidTransitionException when the lifecycle forbids
   *     the move or the payload does not match the target state
   * @throws com.gentoro.jobhook.exception.NotFoundException if the id is unknown
   */
  JobRecord transition(String jobId, JobState next, JsonNode result, JobError error);

  /** Increment the delivery attempt counter. Allowed in any state. */
  JobRecord recordDeliveryAttempt(String jobId);

  /** Set the delivery status. Never changes {@link JobRecord#state()}. */
  JobRecord recordDeliveryStatus(String jobId, DeliveryStatus status);

  /**
   * Remove every terminal record the policy selects.
   *
   * @return number of removed records
   */
  int evict(JobRetentionPolicy policy);

  default JobRecord start(String jobId) {
    return transition(jobId, JobState.EXECUTING, null, null);
  }

  default JobRecord succeed(String jobId, JsonNode result) {
    return transition(jobId, JobState.SUCCEEDED, result, null);
  }

  default JobRecord fail(String jobId, JobError error) {
    return transition(jobId, JobState.FAILED, null, error);
  }
}
