package com.gentoro.jobhook.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.jobhook.exception.AnalysisException;
import java.io.IOException;
import java.net.URI;
import java.util.Objects;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;

/**
 * {@link AnalysisBackend} that delegates to a remote analysis service over HTTP.
 *
 * <p>Request: {@code POST <endpoint>} with {@code {"url": ..., "model": ...}} and a bearer
 * credential. The response is either the analysis object itself or an object whose {@code output}
 * field holds raw model text; both are normalized by {@link AnalysisOutputParser}.
 */
public class HttpAnalysisBackend implements AnalysisBackend {
  private static final Logger log =
      com.gentoro.jobhook.logging.LoggingService.getLogger(HttpAnalysisBackend.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient client;
  private final URI endpoint;
  private final String apiKey;
  private final String model;
  private final ObjectMapper mapper;
  private final AnalysisOutputParser parser;

  public HttpAnalysisBackend(
      OkHttpClient client, URI endpoint, String apiKey, String model, ObjectMapper mapper) {
    this.client = client;
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.apiKey = apiKey;
    this.model = model;
    this.mapper = mapper;
    this.parser = new AnalysisOutputParser(mapper);
  }

  @Override
  public ObjectNode analyze(String url) throws IOException {
    ObjectNode payload = mapper.createObjectNode();
    payload.put("url", url);
    if (model != null) payload.put("model", model);

    Request.Builder builder =
        new Request.Builder()
            .url(endpoint.toString())
            .header("Accept", "application/json")
            .post(RequestBody.create(mapper.writeValueAsBytes(payload), JSON));
    if (apiKey != null) {
      builder.header("Authorization", "Bearer " + apiKey);
    }

    try (Response response = client.newCall(builder.build()).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        log.warn("Analysis upstream answered {} for {}", response.code(), url);
        throw AnalysisException.unavailable(
            "Analysis upstream answered HTTP " + response.code(), null);
      }
      return unwrap(text);
    }
  }

  private ObjectNode unwrap(String text) {
    ObjectNode node = parser.parse(text);
    JsonNode output = node.get("output");
    if (output != null && output.isTextual()) {
      return parser.parse(output.asText());
    }
    return node;
  }
}
