package com.gentoro.jobhook.http.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /webhooks/health: liveness probe. */
public final class WebhookHealthServlet extends HttpServlet {
  private final ObjectMapper mapper;

  public WebhookHealthServlet(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    ObjectNode node = mapper.createObjectNode();
    node.put("status", "healthy");
    node.put("service", "webhook-handler");
    JsonResponses.write(mapper, resp, 200, node);
  }
}
