package com.gentoro.jobhook.analysis;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * External collaborator that turns a resource locator into an analysis document. Implementations
 * may block and may throw anything; {@link AnalysisExecutor} bounds and normalizes the call.
 */
@FunctionalInterface
public interface AnalysisBackend {
  ObjectNode analyze(String url) throws Exception;
}
