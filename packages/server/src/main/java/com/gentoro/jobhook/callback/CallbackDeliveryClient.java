package com.gentoro.jobhook.callback;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.jobhook.exception.NotFoundException;
import com.gentoro.jobhook.jobs.DeliveryStatus;
import com.gentoro.jobhook.jobs.JobStore;
import com.gentoro.jobhook.signature.SignatureCodec;
import java.io.IOException;
import java.time.Duration;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;

/**
 * Signs and POSTs {@link CallbackEnvelope}s.
 *
 * <p>The envelope is serialized once; the signature and the request body use the same bytes.
 * Transport failures and 5xx answers are retried with exponential backoff up to {@code
 * maxAttempts}; any other non-2xx answer ends delivery at once. Attempts and the final status are
 * recorded on the job in the {@link JobStore}, never its lifecycle state.
 */
public class CallbackDeliveryClient {
  private static final Logger log =
      com.gentoro.jobhook.logging.LoggingService.getLogger(CallbackDeliveryClient.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  /** Blocking pause between attempts. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    Sleeper THREAD = d -> Thread.sleep(d.toMillis());
  }

  private final OkHttpClient client;
  private final ObjectMapper mapper;
  private final JobStore store;
  private final int maxAttempts;
  private final Backoff backoff;
  private final Sleeper sleeper;

  public CallbackDeliveryClient(
      OkHttpClient client,
      ObjectMapper mapper,
      JobStore store,
      int maxAttempts,
      Duration backoffBase,
      Duration backoffMax,
      Sleeper sleeper) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.client = client;
    this.mapper = mapper;
    this.store = store;
    this.maxAttempts = maxAttempts;
    this.backoff = new Backoff(backoffBase, backoffMax);
    this.sleeper = sleeper;
  }

  public DeliveryOutcome deliver(String callbackUrl, CallbackEnvelope envelope, String secret) {
    String jobId = envelope.jobId();
    byte[] body;
    try {
      body = envelope.toBytes(mapper);
    } catch (JsonProcessingException e) {
      log.error("Could not serialize callback for job {}", jobId, e);
      return finish(jobId, DeliveryOutcome.exhausted(0, -1, "serialization failed"));
    }

    Request request;
    try {
      request =
          new Request.Builder()
              .url(callbackUrl)
              .header(SignatureCodec.HEADER, SignatureCodec.headerValue(secret, body))
              .header("Content-Type", "application/json")
              .post(RequestBody.create(body, JSON))
              .build();
    } catch (IllegalArgumentException e) {
      log.warn("Callback URL for job {} is not usable: {}", jobId, callbackUrl);
      return finish(jobId, DeliveryOutcome.exhausted(0, -1, "invalid callback URL"));
    }

    int lastStatus = -1;
    String lastFailure = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      recordAttempt(jobId);
      try (Response response = client.newCall(request).execute()) {
        lastStatus = response.code();
        if (response.isSuccessful()) {
          log.info("Callback for job {} delivered on attempt {} ({})", jobId, attempt, lastStatus);
          return finish(jobId, DeliveryOutcome.delivered(attempt, lastStatus));
        }
        if (lastStatus < 500) {
          log.warn(
              "Callback for job {} permanently rejected with HTTP {}; not retrying",
              jobId,
              lastStatus);
          return finish(
              jobId, DeliveryOutcome.exhausted(attempt, lastStatus, "rejected with HTTP " + lastStatus));
        }
        lastFailure = "HTTP " + lastStatus;
      } catch (IOException e) {
        lastStatus = -1;
        lastFailure = e.getClass().getSimpleName() + ": " + e.getMessage();
      }

      log.info(
          "Callback attempt {}/{} for job {} failed: {}", attempt, maxAttempts, jobId, lastFailure);
      if (attempt < maxAttempts) {
        try {
          sleeper.sleep(backoff.delayAfter(attempt));
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          return finish(
              jobId, DeliveryOutcome.exhausted(attempt, lastStatus, "interrupted during backoff"));
        }
      }
    }
    return finish(
        jobId,
        DeliveryOutcome.exhausted(maxAttempts, lastStatus, "retries exhausted, last " + lastFailure));
  }

  private DeliveryOutcome finish(String jobId, DeliveryOutcome outcome) {
    DeliveryStatus status =
        outcome.isDelivered() ? DeliveryStatus.DELIVERED : DeliveryStatus.EXHAUSTED;
    if (!outcome.isDelivered()) {
      log.warn(
          "Callback delivery exhausted for job {} after {} attempt(s): {}",
          jobId,
          outcome.attempts(),
          outcome.reason());
    }
    try {
      store.recordDeliveryStatus(jobId, status);
    } catch (NotFoundException e) {
      log.debug("Job {} evicted before delivery status {} was recorded", jobId, status);
    }
    return outcome;
  }

  private void recordAttempt(String jobId) {
    try {
      store.recordDeliveryAttempt(jobId);
    } catch (NotFoundException e) {
      log.debug("Job {} evicted before delivery attempt was recorded", jobId);
    }
  }
}
