package com.gentoro.jobhook.callback;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.jobhook.jobs.JobError;
import com.gentoro.jobhook.jobs.JobRecord;
import com.gentoro.jobhook.jobs.JobState;
import java.time.Instant;

/** Body POSTed to a caller's callback URL once an async job reaches a terminal state. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"job_id", "status", "result", "error", "message", "timestamp"})
public record CallbackEnvelope(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("status") String status,
    @JsonProperty("result") JsonNode result,
    @JsonProperty("error") JobError error,
    @JsonProperty("message") String message,
    @JsonProperty("timestamp") String timestamp) {

  public static final String COMPLETED = "completed";
  public static final String FAILED = "failed";

  /** Envelope for a terminal job record. */
  public static CallbackEnvelope of(JobRecord record, Instant now) {
    if (record.state() == JobState.SUCCEEDED) {
      return new CallbackEnvelope(
          record.jobId(),
          COMPLETED,
          record.result(),
          null,
          "Job analysis completed successfully",
          now.toString());
    }
    if (record.state() == JobState.FAILED) {
      return new CallbackEnvelope(
          record.jobId(),
          FAILED,
          null,
          record.error(),
          "Job analysis failed",
          now.toString());
    }
    throw new IllegalArgumentException(
        "Job %s is not terminal: %s".formatted(record.jobId(), record.state()));
  }

  /** The canonical byte form; signed and sent as-is. */
  public byte[] toBytes(ObjectMapper mapper) throws JsonProcessingException {
    return mapper.writeValueAsBytes(this);
  }
}
