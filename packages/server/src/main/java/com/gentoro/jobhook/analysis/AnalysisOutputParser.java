package com.gentoro.jobhook.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.jobhook.exception.AnalysisException;
import java.util.regex.Pattern;

/**
 * Extracts the JSON object from model output that may be wrapped in markdown code fences or
 * surrounded by prose.
 */
public final class AnalysisOutputParser {
  private static final Pattern CODE_FENCE = Pattern.compile("^```(?:json)?|```$", Pattern.MULTILINE);

  private final ObjectMapper mapper;

  public AnalysisOutputParser(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public ObjectNode parse(String output) {
    if (output == null || output.isBlank()) {
      throw AnalysisException.invalidResponse("Upstream returned an empty body", null);
    }
    String cleaned = CODE_FENCE.matcher(output.strip()).replaceAll("").strip();

    int start = cleaned.indexOf('{');
    int end = cleaned.lastIndexOf('}');
    if (start < 0 || end < start) {
      throw AnalysisException.invalidResponse("No JSON object found in upstream output", null);
    }

    JsonNode node;
    try {
      node = mapper.readTree(cleaned.substring(start, end + 1));
    } catch (JsonProcessingException e) {
      throw AnalysisException.invalidResponse(
          "Upstream output is not valid JSON: " + e.getOriginalMessage(), e);
    }
    if (!(node instanceof ObjectNode object)) {
      throw AnalysisException.invalidResponse("Upstream output is not a JSON object", null);
    }
    return object;
  }
}
