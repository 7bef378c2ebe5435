package com.gentoro.jobhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.jobhook.analysis.AnalysisExecutor;
import com.gentoro.jobhook.analysis.HttpAnalysisBackend;
import com.gentoro.jobhook.callback.CallbackDeliveryClient;
import com.gentoro.jobhook.config.WebhookSettings;
import com.gentoro.jobhook.dispatch.WebhookDispatcher;
import com.gentoro.jobhook.exception.ConfigException;
import com.gentoro.jobhook.exception.ExecutionException;
import com.gentoro.jobhook.exception.StateException;
import com.gentoro.jobhook.http.EmbeddedJettyServer;
import com.gentoro.jobhook.http.OkHttpFactory;
import com.gentoro.jobhook.http.WebhookServer;
import com.gentoro.jobhook.jobs.InMemoryJobStore;
import com.gentoro.jobhook.jobs.JobStore;
import com.gentoro.jobhook.jobs.TerminalAgeRetentionPolicy;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/**
 * Application root: builds every component from configuration, starts the HTTP listener and owns
 * shutdown.
 */
public class JobHook {

  private static final org.slf4j.Logger log =
      com.gentoro.jobhook.logging.LoggingService.getLogger(JobHook.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private WebhookSettings settings;
  private ObjectMapper mapper;
  private JobStore jobStore;
  private AnalysisExecutor analysisExecutor;
  private WebhookDispatcher dispatcher;
  private EmbeddedJettyServer httpServer;
  private ScheduledExecutorService retentionSweeper;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public JobHook(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.jobhook.logging.LoggingService.applyConfiguration(configuration());
    this.settings = WebhookSettings.from(configuration());
    log.info("Starting with {}", settings);

    if (settings.analysisEndpoint() == null) {
      throw new ConfigException("Missing analysis.endpoint configuration");
    }

    this.mapper = new ObjectMapper();
    this.jobStore = new InMemoryJobStore();

    OkHttpClient analysisHttp =
        OkHttpFactory.create(settings.analysisConnectTimeout(), settings.analysisTimeout());
    this.analysisExecutor =
        new AnalysisExecutor(
            new HttpAnalysisBackend(
                analysisHttp,
                settings.analysisEndpoint(),
                settings.analysisApiKey(),
                settings.analysisModel(),
                mapper),
            settings.analysisTimeout());

    OkHttpClient callbackHttp =
        OkHttpFactory.create(settings.callbackConnectTimeout(), settings.callbackReadTimeout());
    CallbackDeliveryClient callbacks =
        new CallbackDeliveryClient(
            callbackHttp,
            mapper,
            jobStore,
            settings.callbackMaxAttempts(),
            settings.callbackBackoffBase(),
            settings.callbackBackoffMax(),
            CallbackDeliveryClient.Sleeper.THREAD);

    this.dispatcher = new WebhookDispatcher(settings, jobStore, analysisExecutor, callbacks, mapper);

    if (settings.retentionEnabled()) {
      startRetentionSweeper();
    }

    this.httpServer = new EmbeddedJettyServer(settings);
    httpServer.prepare();
    try {
      new WebhookServer(settings, dispatcher, jobStore, mapper)
          .register(httpServer.getContextHandler());
      httpServer.start();
    } catch (Exception e) {
      shutdown();
      throw new ExecutionException("Could not start http server", e);
    }
  }

  private void startRetentionSweeper() {
    TerminalAgeRetentionPolicy policy = new TerminalAgeRetentionPolicy(settings.jobRetention());
    long periodSeconds = Math.max(1, Math.min(60, settings.jobRetention().toSeconds()));
    retentionSweeper =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "job-retention");
              t.setDaemon(true);
              return t;
            });
    retentionSweeper.scheduleAtFixedRate(
        () -> {
          try {
            jobStore.evict(policy);
          } catch (RuntimeException e) {
            log.error("Job retention sweep failed", e);
          }
        },
        periodSeconds,
        periodSeconds,
        TimeUnit.SECONDS);
    log.info("Evicting terminal jobs older than {}", settings.jobRetention());
  }

  /** Park the calling thread until the JVM shutdown hook or {@link #shutdown()} runs. */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "jobhook-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Stop the listener first so no new webhooks arrive, then drain running jobs and callback
   * deliveries. Repeated calls are no-ops.
   */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    try {
      if (httpServer != null) httpServer.close();
      if (retentionSweeper != null) retentionSweeper.shutdownNow();
      if (dispatcher != null) dispatcher.shutdown(Duration.ofSeconds(10));
      if (analysisExecutor != null) analysisExecutor.close();
    } catch (RuntimeException e) {
      log.error("Error during shutdown", e);
    } finally {
      shutdownLatch.countDown();
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("JobHook not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public WebhookSettings settings() {
    return settings;
  }

  public JobStore jobStore() {
    return jobStore;
  }

  public WebhookDispatcher dispatcher() {
    return dispatcher;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
