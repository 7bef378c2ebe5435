package com.gentoro.jobhook.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void errorDetailsKeepCodeAndContext() {
    JobHookException e = new ConflictException("Job already exists: j1").withContext("job_id", "j1");

    ErrorDetails details = ExceptionUtil.toErrorDetails(e);

    assertEquals("ConflictException", details.type());
    assertEquals(JobHookErrorCode.CONFLICT, details.code());
    assertEquals("j1", details.context().get("job_id"));
    assertNotNull(details.time());
  }

  @Test
  void foreignThrowablesAreUnknown() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IOException());
    assertEquals(JobHookErrorCode.UNKNOWN, details.code());
    assertEquals("", details.message());
  }

  @Test
  void describeIsShortAndCodeFirst() {
    assertEquals(
        "UPSTREAM_TIMEOUT: slow", ExceptionUtil.describe(AnalysisException.timeout("slow", null)));
    assertEquals("IOException", ExceptionUtil.describe(new IOException()));
    assertEquals("Unknown error", ExceptionUtil.describe(null));
  }

  @Test
  void compactStackTraceIsSingleLine() {
    String trace = ExceptionUtil.formatCompactStackTrace(new IllegalStateException("x"), 3);
    assertFalse(trace.contains("\n"));
    assertTrue(trace.startsWith(ExceptionUtilTest.class.getName()));
    assertEquals(2, trace.split(" > ").length - 1);
  }

  @Test
  void rethrowIfUncheckedKeepsApplicationExceptions() {
    BadRequestException original = new BadRequestException("bad");
    assertSame(original, ExceptionUtil.rethrowIfUnchecked(original, t -> new StateException("x")));
    JobHookException wrapped =
        ExceptionUtil.rethrowIfUnchecked(new IOException("io"), t -> new NetworkException("net", t));
    assertEquals(JobHookErrorCode.NETWORK_ERROR, wrapped.getCode());
  }
}
