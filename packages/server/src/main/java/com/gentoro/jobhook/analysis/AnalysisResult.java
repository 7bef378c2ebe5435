package com.gentoro.jobhook.analysis;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;

/** Successful analysis outcome. */
public record AnalysisResult(ObjectNode data, Duration elapsed) {}
