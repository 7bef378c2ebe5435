package com.gentoro.jobhook.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.jobhook.exception.ConflictException;
import com.gentoro.jobhook.exception.InvalidTransitionException;
import com.gentoro.jobhook.exception.NotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;

/**
 * {@link JobStore} backed by a {@link ConcurrentHashMap}. Every write goes through the map's
 * per-key atomic operations, so concurrent updates of one job are applied one after the other and
 * a losing invalid transition fails instead of overwriting.
 */
public final class InMemoryJobStore implements JobStore {
  private static final Logger log =
      com.gentoro.jobhook.logging.LoggingService.getLogger(InMemoryJobStore.class);

  private final Map<String, JobRecord> map = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryJobStore() {
    this(Clock.systemUTC());
  }

  public InMemoryJobStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public JobRecord create(String jobId, String url, String callbackUrl) {
    JobRecord record = JobRecord.accepted(jobId, url, callbackUrl, clock.instant());
    JobRecord existing = map.putIfAbsent(jobId, record);
    if (existing != null) {
      throw new ConflictException("Job already exists: " + jobId).withContext("job_id", jobId);
    }
    log.debug("Job {} created in state {}", jobId, record.state());
    return record;
  }

  @Override
  public JobRecord get(String jobId) {
    JobRecord record = map.get(jobId);
    if (record == null) {
      throw new NotFoundException("Unknown job: " + jobId).withContext("job_id", jobId);
    }
    return record;
  }

  @Override
  public boolean exists(String jobId) {
    return map.containsKey(jobId);
  }

  @Override
  public JobRecord transition(String jobId, JobState next, JsonNode result, JobError error) {
    JobRecord updated =
        update(
            jobId,
            current -> {
              if (!current.state().canTransitionTo(next)) {
                throw new InvalidTransitionException(
                    "Job %s cannot move from %s to %s".formatted(jobId, current.state(), next));
              }
              boolean needsResult = next == JobState.SUCCEEDED;
              boolean needsError = next == JobState.FAILED;
              if (needsResult != (result != null) || needsError != (error != null)) {
                throw new InvalidTransitionException(
                    "Job %s: %s requires %s".formatted(jobId, next, payloadRule(next)));
              }
              return current.withState(next, result, error, clock.instant());
            });
    log.debug("Job {} -> {}", jobId, next);
    return updated;
  }

  @Override
  public JobRecord recordDeliveryAttempt(String jobId) {
    return update(jobId, current -> current.withDeliveryAttempt(clock.instant()));
  }

  @Override
  public JobRecord recordDeliveryStatus(String jobId, DeliveryStatus status) {
    return update(jobId, current -> current.withDeliveryStatus(status, clock.instant()));
  }

  @Override
  public int evict(JobRetentionPolicy policy) {
    Instant now = clock.instant();
    int removed = 0;
    for (Map.Entry<String, JobRecord> e : map.entrySet()) {
      JobRecord r = e.getValue();
      if (r.isTerminal() && policy.shouldEvict(r, now) && map.remove(e.getKey(), r)) {
        removed++;
      }
    }
    if (removed > 0) {
      log.info("Evicted {} terminal job(s)", removed);
    }
    return removed;
  }

  private JobRecord update(String jobId, UnaryOperator<JobRecord> change) {
    JobRecord updated = map.computeIfPresent(jobId, (id, current) -> change.apply(current));
    if (updated == null) {
      throw new NotFoundException("Unknown job: " + jobId);
    }
    return updated;
  }

  private static String payloadRule(JobState next) {
    return switch (next) {
      case SUCCEEDED -> "a result and no error";
      case FAILED -> "an error and no result";
      default -> "neither result nor error";
    };
  }
}
