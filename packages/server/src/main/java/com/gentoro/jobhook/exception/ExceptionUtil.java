package com.gentoro.jobhook.exception;

import java.time.Instant;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Helpers for turning failures into log lines and structured details. */
public final class ExceptionUtil {
  private static final int DEFAULT_FRAMES = 10;

  private ExceptionUtil() {}

  /** Structured view of {@code t}; code and context survive for application exceptions. */
  public static ErrorDetails toErrorDetails(Throwable t) {
    JobHookErrorCode code = JobHookErrorCode.UNKNOWN;
    Map<String, Object> context = null;
    if (t instanceof JobHookException jhe) {
      code = jhe.getCode();
      context = jhe.getContext();
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(), nullToEmpty(t.getMessage()), code, context, Instant.now());
  }

  /**
   * One-line stack summary, innermost frame first, frames joined by {@code " > "}.
   *
   * @param maxFrames frames to keep; {@code <= 0} keeps all
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null || t.getStackTrace() == null) return "";
    Stream<StackTraceElement> frames = Stream.of(t.getStackTrace());
    if (maxFrames > 0) {
      frames = frames.limit(maxFrames);
    }
    return frames.map(ExceptionUtil::frame).collect(Collectors.joining(" > "));
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, DEFAULT_FRAMES);
  }

  private static String frame(StackTraceElement e) {
    String file = e.getFileName() == null ? "Unknown Source" : e.getFileName();
    String line = e.getLineNumber() >= 0 ? ":" + e.getLineNumber() : "";
    return "%s.%s (%s%s)".formatted(e.getClassName(), e.getMethodName(), file, line);
  }

  /**
   * Short description for job records and logs: error code first for application exceptions,
   * simple type name otherwise. No stack frames.
   */
  public static String describe(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    String head = t instanceof JobHookException jhe ? jhe.getCode().name() : t.getClass().getSimpleName();
    String message = t.getMessage();
    return message == null || message.isBlank() ? head : head + ": " + message;
  }

  /** Pass application exceptions through unchanged; wrap anything else with {@code wrapper}. */
  public static JobHookException rethrowIfUnchecked(
      Throwable t, Function<Throwable, JobHookException> wrapper) {
    return t instanceof JobHookException jhe ? jhe : wrapper.apply(t);
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }
}
