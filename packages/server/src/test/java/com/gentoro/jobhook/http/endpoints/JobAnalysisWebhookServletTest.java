package com.gentoro.jobhook.http.endpoints;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.jobhook.dispatch.DispatchResult;
import com.gentoro.jobhook.dispatch.WebhookDispatcher;
import com.gentoro.jobhook.exception.AnalysisException;
import com.gentoro.jobhook.exception.BadRequestException;
import com.gentoro.jobhook.exception.ConflictException;
import com.gentoro.jobhook.exception.JobHookException;
import com.gentoro.jobhook.exception.PayloadTooLargeException;
import com.gentoro.jobhook.exception.ServiceUnavailableException;
import com.gentoro.jobhook.exception.StateException;
import com.gentoro.jobhook.exception.UnauthorizedException;
import com.gentoro.jobhook.signature.SignatureCodec;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class JobAnalysisWebhookServletTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private WebhookDispatcher dispatcher;
  private ServletTester tester;

  @BeforeEach
  void setUp() throws Exception {
    dispatcher = Mockito.mock(WebhookDispatcher.class);
    tester = new ServletTester();
    tester.addServlet(
        new ServletHolder(new JobAnalysisWebhookServlet(dispatcher, 64, mapper)),
        "/webhooks/job-analysis");
    tester.start();
  }

  @AfterEach
  void tearDown() throws Exception {
    tester.stop();
  }

  private HttpTester.Response post(String body) throws Exception {
    HttpTester.Request req = HttpTester.newRequest();
    req.setMethod("POST");
    req.setURI("/webhooks/job-analysis");
    req.setVersion("HTTP/1.1");
    req.setHeader("Host", "tester");
    req.setHeader("Content-Type", "application/json");
    req.setHeader(SignatureCodec.HEADER, "sha256=abc");
    req.setContent(body);
    return HttpTester.parseResponse(tester.getResponses(req.generate()));
  }

  private void failWith(JobHookException e) {
    Mockito.when(dispatcher.handleWebhook(Mockito.any(byte[].class), Mockito.anyString()))
        .thenThrow(e);
  }

  @Test
  void syncResultIsReturnedInline() throws Exception {
    Mockito.when(dispatcher.handleWebhook(Mockito.any(byte[].class), Mockito.eq("sha256=abc")))
        .thenReturn(
            new DispatchResult.SyncResult(
                "j1", mapper.createObjectNode().put("job_title", "Engineer")));

    HttpTester.Response resp = post("{}");

    assertEquals(200, resp.getStatus());
    JsonNode json = mapper.readTree(resp.getContent());
    assertEquals("completed", json.get("status").asText());
    assertEquals("j1", json.get("job_id").asText());
    assertEquals("Engineer", json.get("result").get("job_title").asText());
    assertTrue(json.has("timestamp"));
  }

  @Test
  void asyncAcceptanceAnswers202() throws Exception {
    Mockito.when(dispatcher.handleWebhook(Mockito.any(byte[].class), Mockito.anyString()))
        .thenReturn(new DispatchResult.AsyncAccepted("j2"));

    HttpTester.Response resp = post("{}");

    assertEquals(202, resp.getStatus());
    JsonNode json = mapper.readTree(resp.getContent());
    assertEquals("accepted", json.get("status").asText());
    assertEquals("j2", json.get("job_id").asText());
    assertFalse(json.has("result"));
  }

  @Test
  void rejectionsUseGenericBodies() throws Exception {
    failWith(new UnauthorizedException("signature mismatch for secret xyz"));
    HttpTester.Response resp = post("{}");
    assertEquals(401, resp.getStatus());
    assertFalse(resp.getContent().contains("xyz"));
    assertEquals("Unauthorized", mapper.readTree(resp.getContent()).get("message").asText());

    Mockito.reset(dispatcher);
    failWith(new BadRequestException("callback_url is required"));
    resp = post("{}");
    assertEquals(422, resp.getStatus());
    assertFalse(resp.getContent().contains("callback_url"));
  }

  @Test
  void errorCodesMapToHttpStatuses() throws Exception {
    assertStatus(new ConflictException("dup"), 409);
    assertStatus(new PayloadTooLargeException("big"), 413);
    assertStatus(new ServiceUnavailableException("busy"), 503);
    assertStatus(AnalysisException.timeout("slow", null), 504);
    assertStatus(AnalysisException.unavailable("down", null), 502);
    assertStatus(AnalysisException.invalidResponse("garbage", null), 502);
    assertStatus(new StateException("odd"), 500);
  }

  @Test
  void serverSideFailuresCarryErrorCode() throws Exception {
    failWith(AnalysisException.timeout("slow", null));
    JsonNode json = mapper.readTree(post("{}").getContent());
    assertEquals("failed", json.get("status").asText());
    assertEquals("UPSTREAM_TIMEOUT", json.get("error").asText());
  }

  @Test
  void unexpectedExceptionIs500() throws Exception {
    Mockito.when(dispatcher.handleWebhook(Mockito.any(byte[].class), Mockito.anyString()))
        .thenThrow(new IllegalStateException("boom"));
    HttpTester.Response resp = post("{}");
    assertEquals(500, resp.getStatus());
    assertFalse(resp.getContent().contains("boom"));
  }

  @Test
  void declaredOversizeBodyIsRejectedWithoutDispatch() throws Exception {
    HttpTester.Response resp = post("x".repeat(65));
    assertEquals(413, resp.getStatus());
    Mockito.verifyNoInteractions(dispatcher);
  }

  private void assertStatus(JobHookException e, int expected) throws Exception {
    Mockito.reset(dispatcher);
    failWith(e);
    assertEquals(expected, post("{}").getStatus(), e.getCode().name());
  }
}
