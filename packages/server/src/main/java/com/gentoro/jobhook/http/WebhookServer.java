package com.gentoro.jobhook.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.jobhook.config.WebhookSettings;
import com.gentoro.jobhook.dispatch.WebhookDispatcher;
import com.gentoro.jobhook.http.endpoints.JobAnalysisWebhookServlet;
import com.gentoro.jobhook.http.endpoints.JobStatusServlet;
import com.gentoro.jobhook.http.endpoints.WebhookHealthServlet;
import com.gentoro.jobhook.jobs.JobStore;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Registers the webhook endpoints on the shared Jetty context. Every route is prefixed with
 * {@code http.base-path}.
 */
public final class WebhookServer {
  public static final String WEBHOOK_PATH = "/webhooks/job-analysis";
  public static final String HEALTH_PATH = "/webhooks/health";
  public static final String JOBS_PATH = "/jobs";

  private final WebhookSettings settings;
  private final WebhookDispatcher dispatcher;
  private final JobStore store;
  private final ObjectMapper mapper;

  public WebhookServer(
      WebhookSettings settings, WebhookDispatcher dispatcher, JobStore store, ObjectMapper mapper) {
    this.settings = settings;
    this.dispatcher = dispatcher;
    this.store = store;
    this.mapper = mapper;
  }

  public void register(ServletContextHandler ctx) {
    ctx.addServlet(
        new ServletHolder(
            new JobAnalysisWebhookServlet(dispatcher, settings.maxPayloadBytes(), mapper)),
        settings.route(WEBHOOK_PATH));
    ctx.addServlet(
        new ServletHolder(new WebhookHealthServlet(mapper)), settings.route(HEALTH_PATH));
    ctx.addServlet(
        new ServletHolder(new JobStatusServlet(store, mapper)),
        settings.route(JOBS_PATH) + "/*");
  }
}
