package com.gentoro.jobhook.http.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.jobhook.exception.NotFoundException;
import com.gentoro.jobhook.jobs.JobRecord;
import com.gentoro.jobhook.jobs.JobStore;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /jobs/{id} returns the lifecycle and delivery state of an async job. */
public final class JobStatusServlet extends HttpServlet {
  private final JobStore store;
  private final ObjectMapper mapper;

  public JobStatusServlet(JobStore store, ObjectMapper mapper) {
    this.store = store;
    this.mapper = mapper;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String jobId = req.getPathInfo();
    if (jobId == null || jobId.length() <= 1) {
      JsonResponses.write(
          mapper, resp, 400, JsonResponses.envelope(mapper, "rejected", null, "Missing job id"));
      return;
    }
    jobId = jobId.substring(1);

    JobRecord r;
    try {
      r = store.get(jobId);
    } catch (NotFoundException e) {
      JsonResponses.write(
          mapper, resp, 404, JsonResponses.envelope(mapper, "rejected", null, "Unknown job id"));
      return;
    }

    ObjectNode node = mapper.createObjectNode();
    node.put("job_id", r.jobId());
    node.put("state", r.state().name());
    node.put("delivery_status", r.deliveryStatus().name());
    node.put("delivery_attempts", r.deliveryAttempts());
    node.put("created_at", r.createdAt().toString());
    node.put("updated_at", r.updatedAt().toString());
    if (r.result() != null) node.set("result", r.result());
    if (r.error() != null) node.set("error", mapper.valueToTree(r.error()));

    JsonResponses.write(mapper, resp, 200, node);
  }
}
