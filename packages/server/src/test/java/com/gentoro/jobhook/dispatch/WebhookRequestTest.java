package com.gentoro.jobhook.dispatch;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.jobhook.exception.BadRequestException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class WebhookRequestTest {

  private final ObjectMapper mapper = new ObjectMapper();

  private WebhookRequest parse(String json) {
    return WebhookRequest.parse(json.getBytes(StandardCharsets.UTF_8), mapper, true);
  }

  @Test
  void parsesAsyncRequest() {
    WebhookRequest r =
        parse(
            "{\"job_id\":\" j1 \",\"url\":\"https://jobs.example/1\","
                + "\"async_processing\":true,\"callback_url\":\"https://cb.example/hook\","
                + "\"extra\":42}");
    assertEquals("j1", r.jobId());
    assertEquals("https://jobs.example/1", r.url());
    assertTrue(r.asyncProcessing());
    assertEquals("https://cb.example/hook", r.callbackUrl());
  }

  @Test
  void asyncIsTheDefault() {
    WebhookRequest r =
        parse("{\"job_id\":\"j1\",\"url\":\"https://x.example\",\"callback_url\":\"https://cb.example\"}");
    assertTrue(r.asyncProcessing());
  }

  @Test
  void syncRequestDropsCallbackUrl() {
    WebhookRequest r =
        parse(
            "{\"job_id\":\"j1\",\"url\":\"https://x.example\",\"async_processing\":false,"
                + "\"callback_url\":\"https://cb.example\"}");
    assertFalse(r.asyncProcessing());
    assertNull(r.callbackUrl());
  }

  @Test
  void rejectsInvalidPayloads() {
    String[] bad = {
      "not json",
      "[1,2]",
      "{}",
      "{\"job_id\":\"  \",\"url\":\"https://x.example\",\"async_processing\":false}",
      "{\"job_id\":7,\"url\":\"https://x.example\",\"async_processing\":false}",
      "{\"job_id\":\"j1\",\"async_processing\":false}",
      "{\"job_id\":\"j1\",\"url\":\"jobs.example/relative\",\"async_processing\":false}",
      "{\"job_id\":\"j1\",\"url\":\"http://plain.example\",\"async_processing\":false}",
      "{\"job_id\":\"j1\",\"url\":\"https://x.example\",\"async_processing\":\"yes\"}",
      "{\"job_id\":\"j1\",\"url\":\"https://x.example\",\"async_processing\":true}",
      "{\"job_id\":\"j1\",\"url\":\"https://x.example\",\"callback_url\":\"ftp://cb.example\"}",
    };
    for (String json : bad) {
      assertThrows(BadRequestException.class, () -> parse(json), json);
    }
  }

  @Test
  void plainHttpAllowedWhenHttpsNotRequired() {
    WebhookRequest r =
        WebhookRequest.parse(
            "{\"job_id\":\"j1\",\"url\":\"http://x.example\",\"callback_url\":\"http://127.0.0.1:9/cb\"}"
                .getBytes(StandardCharsets.UTF_8),
            mapper,
            false);
    assertEquals("http://127.0.0.1:9/cb", r.callbackUrl());
  }
}
