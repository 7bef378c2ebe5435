package com.gentoro.jobhook.config;

import com.gentoro.jobhook.exception.ConfigException;
import java.net.URI;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable snapshot of every setting the webhook pipeline reads. Built once at startup from the
 * application {@link Configuration} and handed to each component through its constructor.
 */
public record WebhookSettings(
    String hostname,
    int port,
    String basePath,
    String secret,
    int maxPayloadBytes,
    boolean requireHttps,
    URI analysisEndpoint,
    String analysisApiKey,
    String analysisModel,
    Duration analysisTimeout,
    Duration analysisConnectTimeout,
    int callbackMaxAttempts,
    Duration callbackBackoffBase,
    Duration callbackBackoffMax,
    Duration callbackConnectTimeout,
    Duration callbackReadTimeout,
    int workerPoolSize,
    int workerQueueCapacity,
    Duration jobRetention) {

  public WebhookSettings {
    if (StringUtils.isBlank(secret)) {
      throw new ConfigException("Missing webhook.secret configuration");
    }
    requirePositive("http.port", port, true);
    requirePositive("webhook.max-payload-bytes", maxPayloadBytes, false);
    requirePositive("callback.max-attempts", callbackMaxAttempts, false);
    requirePositive("workers.pool-size", workerPoolSize, false);
    requirePositive("workers.queue-capacity", workerQueueCapacity, false);
    requirePositive("analysis.timeout-ms", analysisTimeout);
    requirePositive("analysis.connect-timeout-ms", analysisConnectTimeout);
    requirePositive("callback.connect-timeout-ms", callbackConnectTimeout);
    requirePositive("callback.read-timeout-ms", callbackReadTimeout);
    if (callbackBackoffBase.isNegative() || callbackBackoffMax.compareTo(callbackBackoffBase) < 0) {
      throw new ConfigException("callback.backoff-max-ms must be >= callback.backoff-base-ms >= 0");
    }
    if (jobRetention.isNegative()) {
      throw new ConfigException("jobs.retention-minutes must not be negative");
    }
    basePath = normalizeBasePath(basePath);
  }

  public static WebhookSettings from(Configuration cfg) {
    return new WebhookSettings(
        StringUtils.defaultIfBlank(cfg.getString("http.hostname", "0.0.0.0"), "0.0.0.0").trim(),
        cfg.getInt("http.port", 8080),
        cfg.getString("http.base-path", ""),
        resolved(cfg.getString("webhook.secret", null)),
        cfg.getInt("webhook.max-payload-bytes", 1024 * 1024),
        cfg.getBoolean("webhook.require-https", true),
        parseUri("analysis.endpoint", resolved(cfg.getString("analysis.endpoint", null))),
        StringUtils.trimToNull(resolved(cfg.getString("analysis.api-key", null))),
        StringUtils.trimToNull(resolved(cfg.getString("analysis.model", null))),
        Duration.ofMillis(cfg.getLong("analysis.timeout-ms", 120_000L)),
        Duration.ofMillis(cfg.getLong("analysis.connect-timeout-ms", 5_000L)),
        cfg.getInt("callback.max-attempts", 3),
        Duration.ofMillis(cfg.getLong("callback.backoff-base-ms", 500L)),
        Duration.ofMillis(cfg.getLong("callback.backoff-max-ms", 10_000L)),
        Duration.ofMillis(cfg.getLong("callback.connect-timeout-ms", 5_000L)),
        Duration.ofMillis(cfg.getLong("callback.read-timeout-ms", 10_000L)),
        cfg.getInt("workers.pool-size", 4),
        cfg.getInt("workers.queue-capacity", 100),
        Duration.ofMinutes(cfg.getLong("jobs.retention-minutes", 0L)));
  }

  /** Route path under the configured base path, e.g. {@code /api/v1/webhooks/job-analysis}. */
  public String route(String path) {
    return basePath + path;
  }

  public boolean retentionEnabled() {
    return !jobRetention.isZero();
  }

  @Override
  public String toString() {
    return "WebhookSettings[hostname=%s, port=%d, basePath='%s', secret=***, maxPayloadBytes=%d, requireHttps=%s, analysisEndpoint=%s, analysisTimeout=%s, analysisConnectTimeout=%s, callbackMaxAttempts=%d, callbackBackoffBase=%s, callbackBackoffMax=%s, workerPoolSize=%d, workerQueueCapacity=%d, jobRetention=%s]"
        .formatted(
            hostname,
            port,
            basePath,
            maxPayloadBytes,
            requireHttps,
            analysisEndpoint,
            analysisTimeout,
            analysisConnectTimeout,
            callbackMaxAttempts,
            callbackBackoffBase,
            callbackBackoffMax,
            workerPoolSize,
            workerQueueCapacity,
            jobRetention);
  }

  /** An {@code ${env:...}} reference whose variable is unset is left verbatim; treat it as absent. */
  private static String resolved(String value) {
    return value != null && value.startsWith("${") ? null : value;
  }

  private static URI parseUri(String key, String value) {
    if (StringUtils.isBlank(value)) return null;
    try {
      URI uri = URI.create(value.trim());
      if (uri.getScheme() == null || uri.getHost() == null) {
        throw new ConfigException("%s must be an absolute URL: %s".formatted(key, value));
      }
      return uri;
    } catch (IllegalArgumentException e) {
      throw new ConfigException("%s is not a valid URL: %s".formatted(key, value), e);
    }
  }

  private static String normalizeBasePath(String path) {
    String p = StringUtils.strip(StringUtils.defaultString(path).trim(), "/");
    return p.isEmpty() ? "" : "/" + p;
  }

  private static void requirePositive(String key, int value, boolean allowZero) {
    if (value < 0 || (!allowZero && value == 0)) {
      throw new ConfigException("%s must be positive, got %d".formatted(key, value));
    }
  }

  private static void requirePositive(String key, Duration value) {
    if (value.isZero() || value.isNegative()) {
      throw new ConfigException("%s must be positive, got %s".formatted(key, value));
    }
  }
}
