package com.gentoro.jobhook.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * Immutable snapshot of a job. The {@link JobStore} owns the current snapshot per job id and
 * replaces it atomically; nothing else constructs modified copies.
 *
 * <p>{@code result} is set only in {@link JobState#SUCCEEDED}, {@code error} only in {@link
 * JobState#FAILED}.
 */
public record JobRecord(
    String jobId,
    String url,
    JobState state,
    Instant createdAt,
    Instant updatedAt,
    JsonNode result,
    JobError error,
    String callbackUrl,
    DeliveryStatus deliveryStatus,
    int deliveryAttempts) {

  static JobRecord accepted(String jobId, String url, String callbackUrl, Instant now) {
    return new JobRecord(
        jobId,
        url,
        JobState.ACCEPTED,
        now,
        now,
        null,
        null,
        callbackUrl,
        callbackUrl == null ? DeliveryStatus.NOT_REQUESTED : DeliveryStatus.PENDING,
        0);
  }

  public boolean isTerminal() {
    return state.isTerminal();
  }

  JobRecord withState(JobState next, JsonNode result, JobError error, Instant now) {
    return new JobRecord(
        jobId,
        url,
        next,
        createdAt,
        now,
        result,
        error,
        callbackUrl,
        deliveryStatus,
        deliveryAttempts);
  }

  JobRecord withDeliveryAttempt(Instant now) {
    return new JobRecord(
        jobId,
        url,
        state,
        createdAt,
        now,
        result,
        error,
        callbackUrl,
        deliveryStatus,
        deliveryAttempts + 1);
  }

  JobRecord withDeliveryStatus(DeliveryStatus status, Instant now) {
    return new JobRecord(
        jobId, url, state, createdAt, now, result, error, callbackUrl, status, deliveryAttempts);
  }
}
