package com.gentoro.jobhook.exception;

/**
 * Typed failure of the analysis upstream. The error code is always one of {@link
 * JobHookErrorCode#UPSTREAM_UNAVAILABLE}, {@link JobHookErrorCode#UPSTREAM_TIMEOUT} or {@link
 * JobHookErrorCode#UPSTREAM_INVALID_RESPONSE}.
 */
public class AnalysisException extends JobHookException {

  private AnalysisException(JobHookErrorCode code, String message, Throwable cause) {
    super(code, message, cause);
  }

  public static AnalysisException unavailable(String message, Throwable cause) {
    return new AnalysisException(JobHookErrorCode.UPSTREAM_UNAVAILABLE, message, cause);
  }

  public static AnalysisException timeout(String message, Throwable cause) {
    return new AnalysisException(JobHookErrorCode.UPSTREAM_TIMEOUT, message, cause);
  }

  public static AnalysisException invalidResponse(String message, Throwable cause) {
    return new AnalysisException(JobHookErrorCode.UPSTREAM_INVALID_RESPONSE, message, cause);
  }
}
