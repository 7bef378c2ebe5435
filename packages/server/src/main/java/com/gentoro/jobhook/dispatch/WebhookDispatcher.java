package com.gentoro.jobhook.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.jobhook.analysis.AnalysisExecutor;
import com.gentoro.jobhook.analysis.AnalysisResult;
import com.gentoro.jobhook.callback.CallbackDeliveryClient;
import com.gentoro.jobhook.callback.CallbackEnvelope;
import com.gentoro.jobhook.config.WebhookSettings;
import com.gentoro.jobhook.exception.AnalysisException;
import com.gentoro.jobhook.exception.ExceptionUtil;
import com.gentoro.jobhook.exception.JobHookErrorCode;
import com.gentoro.jobhook.exception.JobHookException;
import com.gentoro.jobhook.exception.PayloadTooLargeException;
import com.gentoro.jobhook.exception.ServiceUnavailableException;
import com.gentoro.jobhook.exception.UnauthorizedException;
import com.gentoro.jobhook.jobs.DeliveryStatus;
import com.gentoro.jobhook.jobs.JobError;
import com.gentoro.jobhook.jobs.JobRecord;
import com.gentoro.jobhook.jobs.JobState;
import com.gentoro.jobhook.jobs.JobStore;
import com.gentoro.jobhook.signature.SignatureCodec;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Orchestrates inbound webhooks: authenticates the raw body, validates it, and either runs the
 * analysis inline or records a job and runs it on the background worker pool.
 *
 * <p>Background completions are consumed by {@link #complete}, which sets the job's terminal
 * state and hands the callback to the delivery pool. Delivery outcome never changes that state.
 */
public class WebhookDispatcher implements AutoCloseable {
  private static final Logger log =
      com.gentoro.jobhook.logging.LoggingService.getLogger(WebhookDispatcher.class);

  private final WebhookSettings settings;
  private final JobStore store;
  private final AnalysisExecutor analysis;
  private final CallbackDeliveryClient callbacks;
  private final ObjectMapper mapper;
  private final ExecutorService workers;
  private final ExecutorService deliveries;
  private final Clock clock;

  public WebhookDispatcher(
      WebhookSettings settings,
      JobStore store,
      AnalysisExecutor analysis,
      CallbackDeliveryClient callbacks,
      ObjectMapper mapper) {
    this(
        settings,
        store,
        analysis,
        callbacks,
        mapper,
        boundedPool("job-worker", settings.workerPoolSize(), settings.workerQueueCapacity()),
        boundedPool("callback-delivery", settings.workerPoolSize(), settings.workerQueueCapacity()),
        Clock.systemUTC());
  }

  public WebhookDispatcher(
      WebhookSettings settings,
      JobStore store,
      AnalysisExecutor analysis,
      CallbackDeliveryClient callbacks,
      ObjectMapper mapper,
      ExecutorService workers,
      ExecutorService deliveries,
      Clock clock) {
    this.settings = settings;
    this.store = store;
    this.analysis = analysis;
    this.callbacks = callbacks;
    this.mapper = mapper;
    this.workers = workers;
    this.deliveries = deliveries;
    this.clock = clock;
  }

  /** Handle a webhook with the configured shared secret. */
  public DispatchResult handleWebhook(byte[] rawBody, String signatureHeader) {
    return handleWebhook(rawBody, signatureHeader, settings.secret());
  }

  /**
   * @throws UnauthorizedException signature missing or wrong; checked before any parsing
   * @throws com.gentoro.jobhook.exception.BadRequestException payload invalid
   * @throws com.gentoro.jobhook.exception.ConflictException async job id already known
   * @throws AnalysisException sync analysis failed
   * @throws ServiceUnavailableException background pool saturated
   */
  public DispatchResult handleWebhook(byte[] rawBody, String signatureHeader, String secret) {
    if (rawBody.length > settings.maxPayloadBytes()) {
      log.info("Webhook {}: body of {} bytes exceeds limit", JobState.REJECTED, rawBody.length);
      throw new PayloadTooLargeException("Payload exceeds " + settings.maxPayloadBytes() + " bytes");
    }
    if (!SignatureCodec.verify(secret, rawBody, signatureHeader)) {
      log.info(
          "Webhook {}: signature {}",
          JobState.REJECTED,
          signatureHeader == null ? "missing" : "mismatch");
      throw new UnauthorizedException("Invalid webhook signature");
    }

    WebhookRequest request;
    try {
      request = WebhookRequest.parse(rawBody, mapper, settings.requireHttps());
    } catch (JobHookException e) {
      log.info("Webhook {}: {}", JobState.REJECTED, e.getMessage());
      throw e;
    }

    return request.asyncProcessing() ? accept(request) : runInline(request);
  }

  private DispatchResult runInline(WebhookRequest request) {
    log.info("Job {} {} (sync) for {}", request.jobId(), JobState.EXECUTING, request.url());
    try {
      AnalysisResult result = analysis.analyze(request.url());
      log.info(
          "Job {} {} (sync) in {} ms",
          request.jobId(),
          JobState.SUCCEEDED,
          result.elapsed().toMillis());
      return new DispatchResult.SyncResult(request.jobId(), result.data());
    } catch (AnalysisException e) {
      log.warn("Job {} {} (sync): {}", request.jobId(), JobState.FAILED, e.getMessage());
      throw e;
    }
  }

  private DispatchResult accept(WebhookRequest request) {
    String jobId = request.jobId();
    store.create(jobId, request.url(), request.callbackUrl());
    try {
      CompletableFuture.supplyAsync(() -> execute(jobId, request.url()), workers)
          .whenComplete((result, error) -> complete(jobId, result, error));
    } catch (RejectedExecutionException e) {
      log.warn("Job {} could not be scheduled: worker pool saturated", jobId);
      complete(
          jobId,
          null,
          new ServiceUnavailableException("Background worker pool is saturated", e));
      throw new ServiceUnavailableException("Background worker pool is saturated", e);
    }
    log.info("Job {} {} (async), callback {}", jobId, JobState.ACCEPTED, request.callbackUrl());
    return new DispatchResult.AsyncAccepted(jobId);
  }

  private AnalysisResult execute(String jobId, String url) {
    store.start(jobId);
    log.info("Job {} {} (async) for {}", jobId, JobState.EXECUTING, url);
    return analysis.analyze(url);
  }

  /** Completion handler for background work: terminal state first, then callback handoff. */
  void complete(String jobId, AnalysisResult result, Throwable error) {
    JobRecord record;
    try {
      if (error == null) {
        record = store.succeed(jobId, result.data());
        log.info("Job {} {} in {} ms", jobId, JobState.SUCCEEDED, result.elapsed().toMillis());
      } else {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
            ? error.getCause()
            : error;
        record = store.fail(jobId, toJobError(cause));
        log.warn("Job {} {}: {}", jobId, JobState.FAILED, ExceptionUtil.describe(cause));
      }
    } catch (JobHookException e) {
      log.error("Job {} could not record its outcome: {}", jobId, e.getMessage());
      return;
    }

    if (record.callbackUrl() != null) {
      handOff(record);
    }
  }

  private void handOff(JobRecord record) {
    CallbackEnvelope envelope = CallbackEnvelope.of(record, clock.instant());
    try {
      deliveries.execute(() -> callbacks.deliver(record.callbackUrl(), envelope, settings.secret()));
    } catch (RejectedExecutionException e) {
      log.warn(
          "Callback delivery exhausted for job {}: delivery pool unavailable", record.jobId());
      store.recordDeliveryStatus(record.jobId(), DeliveryStatus.EXHAUSTED);
    }
  }

  private static JobError toJobError(Throwable cause) {
    if (cause instanceof JobHookException e) {
      return new JobError(e.getCode(), e.getMessage());
    }
    log.error(
        "Unexpected failure in background job: {}", ExceptionUtil.formatCompactStackTrace(cause));
    return new JobError(JobHookErrorCode.UNKNOWN, ExceptionUtil.describe(cause));
  }

  /** Fixed-size pool with a bounded queue; submissions beyond capacity are rejected. */
  static ExecutorService boundedPool(String name, int threads, int queueCapacity) {
    AtomicInteger counter = new AtomicInteger();
    return new ThreadPoolExecutor(
        threads,
        threads,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity),
        r -> {
          Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
          t.setDaemon(true);
          return t;
        },
        new ThreadPoolExecutor.AbortPolicy());
  }

  /** Stop accepting work and wait up to {@code grace} for running jobs and deliveries. */
  public void shutdown(Duration grace) {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Job workers still busy after {} ms", grace.toMillis());
      }
      // completions may still enqueue deliveries until workers are done
      deliveries.shutdown();
      if (!deliveries.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Callback deliveries still busy after {} ms", grace.toMillis());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      workers.shutdownNow();
      deliveries.shutdownNow();
    }
  }

  @Override
  public void close() {
    shutdown(Duration.ofSeconds(5));
  }
}
