package com.gentoro.jobhook.http.endpoints;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.Test;

class WebhookHealthServletTest {

  @Test
  void reportsHealthy() throws Exception {
    ObjectMapper mapper = new ObjectMapper();
    ServletTester tester = new ServletTester();
    tester.addServlet(new ServletHolder(new WebhookHealthServlet(mapper)), "/webhooks/health");
    tester.start();
    try {
      HttpTester.Request req = HttpTester.newRequest();
      req.setMethod("GET");
      req.setURI("/webhooks/health");
      req.setVersion("HTTP/1.1");
      req.setHeader("Host", "tester");

      HttpTester.Response resp = HttpTester.parseResponse(tester.getResponses(req.generate()));

      assertEquals(200, resp.getStatus());
      JsonNode json = mapper.readTree(resp.getContent());
      assertEquals("healthy", json.get("status").asText());
      assertEquals("webhook-handler", json.get("service").asText());
    } finally {
      tester.stop();
    }
  }
}
