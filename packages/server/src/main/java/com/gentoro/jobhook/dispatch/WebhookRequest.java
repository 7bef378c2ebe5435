package com.gentoro.jobhook.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.jobhook.exception.BadRequestException;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * Validated inbound webhook payload.
 *
 * <p>Wire form: {@code {"job_id": string, "url": string, "async_processing": bool,
 * "callback_url": string?}}. Unknown fields are ignored. {@code async_processing} defaults to
 * {@code true}; {@code callbackUrl} is {@code null} for synchronous requests.
 */
public record WebhookRequest(
    String jobId, String url, boolean asyncProcessing, String callbackUrl) {

  public static WebhookRequest parse(byte[] rawBody, ObjectMapper mapper, boolean requireHttps) {
    JsonNode root;
    try {
      root = mapper.readTree(rawBody);
    } catch (IOException e) {
      throw new BadRequestException("Body is not valid JSON");
    }
    if (root == null || !root.isObject()) {
      throw new BadRequestException("Body must be a JSON object");
    }

    String jobId = StringUtils.trimToNull(text(root, "job_id"));
    if (jobId == null) {
      throw new BadRequestException("job_id is required");
    }

    String url = StringUtils.trimToNull(text(root, "url"));
    if (url == null || !isWellFormed(url, requireHttps)) {
      throw new BadRequestException("url must be an absolute " + scheme(requireHttps) + " URL");
    }

    boolean async = true;
    JsonNode asyncNode = root.get("async_processing");
    if (asyncNode != null && !asyncNode.isNull()) {
      if (!asyncNode.isBoolean()) {
        throw new BadRequestException("async_processing must be a boolean");
      }
      async = asyncNode.booleanValue();
    }

    String callbackUrl = null;
    if (async) {
      callbackUrl = StringUtils.trimToNull(text(root, "callback_url"));
      if (callbackUrl == null) {
        throw new BadRequestException("callback_url is required for async processing");
      }
      if (!isWellFormed(callbackUrl, requireHttps)) {
        throw new BadRequestException(
            "callback_url must be an absolute " + scheme(requireHttps) + " URL");
      }
    }
    return new WebhookRequest(jobId, url, async, callbackUrl);
  }

  private static String text(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull()) return null;
    if (!node.isTextual()) {
      throw new BadRequestException(field + " must be a string");
    }
    return node.textValue();
  }

  private static boolean isWellFormed(String value, boolean requireHttps) {
    try {
      URI uri = new URI(value);
      String s = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
      boolean schemeOk = requireHttps ? s.equals("https") : s.equals("https") || s.equals("http");
      return schemeOk && StringUtils.isNotBlank(uri.getHost());
    } catch (URISyntaxException e) {
      return false;
    }
  }

  private static String scheme(boolean requireHttps) {
    return requireHttps ? "https" : "http(s)";
  }
}
