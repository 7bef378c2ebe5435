package com.gentoro.jobhook.http;

import com.gentoro.jobhook.config.WebhookSettings;
import com.gentoro.jobhook.exception.ExceptionUtil;
import com.gentoro.jobhook.exception.NetworkException;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;

/**
 * Jetty 12 listener for the webhook endpoints.
 *
 * <p>{@link #prepare()} builds the server and its root {@link ServletContextHandler} so routes can
 * be registered; {@link #start()} binds the connector. With {@code http.port: 0} the bound port is
 * available from {@link #getPort()} after start.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.jobhook.logging.LoggingService.getLogger(EmbeddedJettyServer.class);
  private static final String ANY_HOST = "0.0.0.0";
  private static final long STOP_TIMEOUT_MS = 2000;

  private final WebhookSettings settings;
  private final Object lock = new Object();
  private Server server;
  private ServletContextHandler context;

  public EmbeddedJettyServer(WebhookSettings settings) {
    this.settings = settings;
  }

  public void prepare() {
    synchronized (lock) {
      if (server != null) {
        return;
      }
      try {
        QueuedThreadPool pool = new QueuedThreadPool();
        pool.setName("webhook-http");
        pool.setDaemon(true);

        Server s = new Server(pool);
        ServerConnector connector = new ServerConnector(s);
        if (!ANY_HOST.equals(settings.hostname())) {
          connector.setHost(settings.hostname());
        }
        connector.setPort(settings.port());
        s.addConnector(connector);

        ServletContextHandler root = new ServletContextHandler();
        root.setContextPath("/");
        s.setHandler(root);

        server = s;
        context = root;
      } catch (RuntimeException e) {
        throw new NetworkException("Could not set up the webhook listener", e);
      }
    }
  }

  public void start() {
    synchronized (lock) {
      if (server == null) {
        prepare();
      }
      if (server.isStarted()) {
        return;
      }
      try {
        server.start();
        log.info(
            "Webhook listener bound to {}:{}{}",
            settings.hostname(),
            boundPort(),
            settings.basePath());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            cause ->
                new NetworkException(
                    "Could not bind webhook listener to %s:%d"
                        .formatted(settings.hostname(), settings.port()),
                    cause));
      }
    }
  }

  public void stop() {
    synchronized (lock) {
      if (server == null) {
        return;
      }
      try {
        if (server.isStarted() || server.isStarting()) {
          server.setStopTimeout(STOP_TIMEOUT_MS);
          server.stop();
        }
      } catch (Exception e) {
        // shutdown continues with the worker pools
        log.error("Webhook listener did not stop cleanly", e);
      } finally {
        server = null;
        context = null;
      }
    }
  }

  public void join() throws InterruptedException {
    Server s;
    synchronized (lock) {
      s = server;
    }
    if (s != null) {
      s.join();
    }
  }

  public boolean isRunning() {
    synchronized (lock) {
      return server != null && server.isRunning();
    }
  }

  /** Bound port once started, the configured port otherwise. */
  public int getPort() {
    synchronized (lock) {
      return server != null && server.isStarted() ? boundPort() : settings.port();
    }
  }

  private int boundPort() {
    return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lock) {
      return context;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
