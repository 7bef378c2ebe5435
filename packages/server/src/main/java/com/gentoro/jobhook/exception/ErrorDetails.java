package com.gentoro.jobhook.exception;

import java.time.Instant;
import java.util.Map;

/** Structured, serializable view of a failure. */
public record ErrorDetails(
    String type, String message, JobHookErrorCode code, Map<String, Object> context, Instant time) {}
