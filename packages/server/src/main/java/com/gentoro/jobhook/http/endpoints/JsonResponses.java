package com.gentoro.jobhook.http.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/** Response envelope helpers shared by the endpoints. */
final class JsonResponses {
  private JsonResponses() {}

  static ObjectNode envelope(ObjectMapper mapper, String status, String jobId, String message) {
    ObjectNode node = mapper.createObjectNode();
    node.put("status", status);
    if (jobId != null) node.put("job_id", jobId);
    node.put("message", message);
    node.put("timestamp", Instant.now().toString());
    return node;
  }

  static void write(ObjectMapper mapper, HttpServletResponse resp, int status, ObjectNode body)
      throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
    resp.getWriter().write(mapper.writeValueAsString(body));
  }
}
