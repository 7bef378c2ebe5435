package com.gentoro.jobhook.callback;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.jobhook.exception.JobHookErrorCode;
import com.gentoro.jobhook.jobs.InMemoryJobStore;
import com.gentoro.jobhook.jobs.JobError;
import com.gentoro.jobhook.jobs.JobRecord;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class CallbackEnvelopeTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private final InMemoryJobStore store = new InMemoryJobStore();
  private final Instant now = Instant.parse("2026-01-01T00:00:00Z");

  @Test
  void successEnvelopeCarriesResultOnly() throws Exception {
    store.create("j1", "https://x", "https://cb");
    store.start("j1");
    JobRecord done = store.succeed("j1", mapper.createObjectNode().put("job_title", "Engineer"));

    JsonNode json = mapper.readTree(CallbackEnvelope.of(done, now).toBytes(mapper));

    assertEquals("j1", json.get("job_id").asText());
    assertEquals("completed", json.get("status").asText());
    assertEquals("Engineer", json.get("result").get("job_title").asText());
    assertFalse(json.has("error"));
    assertEquals("2026-01-01T00:00:00Z", json.get("timestamp").asText());
  }

  @Test
  void failureEnvelopeCarriesErrorOnly() throws Exception {
    store.create("j2", "https://x", "https://cb");
    store.start("j2");
    JobRecord failed =
        store.fail("j2", new JobError(JobHookErrorCode.UPSTREAM_TIMEOUT, "timed out"));

    JsonNode json = mapper.readTree(CallbackEnvelope.of(failed, now).toBytes(mapper));

    assertEquals("failed", json.get("status").asText());
    assertEquals("UPSTREAM_TIMEOUT", json.get("error").get("code").asText());
    assertFalse(json.has("result"));
  }

  @Test
  void nonTerminalRecordIsRefused() {
    JobRecord accepted = store.create("j3", "https://x", "https://cb");
    assertThrows(IllegalArgumentException.class, () -> CallbackEnvelope.of(accepted, now));
  }
}
