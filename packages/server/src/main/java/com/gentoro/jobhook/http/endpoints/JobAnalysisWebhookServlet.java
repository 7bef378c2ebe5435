package com.gentoro.jobhook.http.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.jobhook.dispatch.DispatchResult;
import com.gentoro.jobhook.dispatch.WebhookDispatcher;
import com.gentoro.jobhook.exception.ExceptionUtil;
import com.gentoro.jobhook.exception.JobHookException;
import com.gentoro.jobhook.signature.SignatureCodec;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;

/**
 * POST /webhooks/job-analysis: signed job analysis requests.
 *
 * <p>200 with the inline result for synchronous requests, 202 for accepted asynchronous ones.
 * Authentication and validation failures get a generic body that does not say which check failed.
 */
public final class JobAnalysisWebhookServlet extends HttpServlet {
  private static final Logger log =
      com.gentoro.jobhook.logging.LoggingService.getLogger(JobAnalysisWebhookServlet.class);

  private final WebhookDispatcher dispatcher;
  private final int maxPayloadBytes;
  private final ObjectMapper mapper;

  public JobAnalysisWebhookServlet(
      WebhookDispatcher dispatcher, int maxPayloadBytes, ObjectMapper mapper) {
    this.dispatcher = dispatcher;
    this.maxPayloadBytes = maxPayloadBytes;
    this.mapper = mapper;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    if (req.getContentLengthLong() > maxPayloadBytes) {
      JsonResponses.write(
          mapper, resp, 413, JsonResponses.envelope(mapper, "rejected", null, "Payload too large"));
      return;
    }
    // one byte over the limit is enough for the dispatcher to reject it
    byte[] body = req.getInputStream().readNBytes(maxPayloadBytes + 1);

    try {
      DispatchResult result = dispatcher.handleWebhook(body, req.getHeader(SignatureCodec.HEADER));
      if (result instanceof DispatchResult.SyncResult sync) {
        ObjectNode node =
            JsonResponses.envelope(
                mapper, "completed", sync.jobId(), "Job analysis completed successfully");
        node.set("result", sync.result());
        JsonResponses.write(mapper, resp, 200, node);
      } else {
        JsonResponses.write(
            mapper,
            resp,
            202,
            JsonResponses.envelope(
                mapper, "accepted", result.jobId(), "Job analysis started in background"));
      }
    } catch (JobHookException e) {
      writeError(resp, e);
    } catch (RuntimeException e) {
      log.error("Unexpected failure handling webhook", e);
      JsonResponses.write(
          mapper, resp, 500, JsonResponses.envelope(mapper, "failed", null, "Internal error"));
    }
  }

  private void writeError(HttpServletResponse resp, JobHookException e) throws IOException {
    int status = 500;
    String state = "rejected";
    String message = "Internal error";
    switch (e.getCode()) {
      case UNAUTHORIZED -> {
        status = 401;
        message = "Unauthorized";
      }
      case BAD_REQUEST -> {
        status = 422;
        message = "Invalid request";
      }
      case PAYLOAD_TOO_LARGE -> {
        status = 413;
        message = "Payload too large";
      }
      case CONFLICT -> {
        status = 409;
        message = "Job already exists";
      }
      case SERVICE_UNAVAILABLE -> {
        status = 503;
        state = "failed";
        message = "Service busy, retry later";
      }
      case UPSTREAM_TIMEOUT -> {
        status = 504;
        state = "failed";
        message = "Job analysis timed out";
      }
      case UPSTREAM_UNAVAILABLE, UPSTREAM_INVALID_RESPONSE -> {
        status = 502;
        state = "failed";
        message = "Job analysis failed";
      }
      default -> {
        log.error("Unexpected failure handling webhook: {}", ExceptionUtil.toErrorDetails(e), e);
        status = 500;
        state = "failed";
        message = "Internal error";
      }
    }
    ObjectNode node = JsonResponses.envelope(mapper, state, null, message);
    if (status >= 500) {
      node.put("error", e.getCode().name());
    }
    JsonResponses.write(mapper, resp, status, node);
  }
}
