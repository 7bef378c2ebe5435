package com.gentoro.jobhook.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.jobhook.exception.AnalysisException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Boundary adapter around {@link AnalysisBackend}.
 *
 * <p>Each call runs on a dedicated worker thread and is abandoned (the thread interrupted) once
 * the configured timeout elapses. The outcome is always either an {@link AnalysisResult} or an
 * {@link AnalysisException}; nothing else escapes {@link #analyze(String)}.
 */
public class AnalysisExecutor implements AutoCloseable {
  private static final Logger log =
      com.gentoro.jobhook.logging.LoggingService.getLogger(AnalysisExecutor.class);

  private final AnalysisBackend backend;
  private final Duration timeout;
  private final ExecutorService calls;

  public AnalysisExecutor(AnalysisBackend backend, Duration timeout) {
    this.backend = backend;
    this.timeout = timeout;
    AtomicInteger counter = new AtomicInteger();
    this.calls =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r, "analysis-call-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  public AnalysisResult analyze(String url) {
    long start = System.nanoTime();
    Future<ObjectNode> future;
    try {
      future = calls.submit(() -> backend.analyze(url));
    } catch (RejectedExecutionException e) {
      throw AnalysisException.unavailable("Analysis executor is shut down", e);
    }

    try {
      ObjectNode data = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (data == null) {
        throw AnalysisException.invalidResponse("Upstream returned no analysis document", null);
      }
      Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
      log.debug("Analysis of {} completed in {} ms", url, elapsed.toMillis());
      return new AnalysisResult(data, elapsed);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Analysis of {} exceeded {} ms", url, timeout.toMillis());
      throw AnalysisException.timeout(
          "Analysis timed out after %d ms".formatted(timeout.toMillis()), e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw AnalysisException.unavailable("Interrupted while waiting for analysis", e);
    } catch (ExecutionException e) {
      throw normalize(e.getCause());
    }
  }

  private static AnalysisException normalize(Throwable cause) {
    if (cause instanceof AnalysisException ae) {
      return ae;
    }
    if (cause instanceof JsonProcessingException) {
      return AnalysisException.invalidResponse("Upstream returned malformed JSON", cause);
    }
    if (cause instanceof SocketTimeoutException || cause instanceof InterruptedIOException) {
      return AnalysisException.timeout("Upstream call timed out", cause);
    }
    if (cause instanceof IOException) {
      return AnalysisException.unavailable("Upstream unreachable: " + cause.getMessage(), cause);
    }
    log.error("Unexpected analysis failure", cause);
    return AnalysisException.unavailable("Analysis failed: " + cause, cause);
  }

  @Override
  public void close() {
    calls.shutdownNow();
    try {
      if (!calls.awaitTermination(1, TimeUnit.SECONDS)) {
        log.warn("Analysis calls did not terminate within 1 second");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
