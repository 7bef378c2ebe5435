package com.gentoro.jobhook.exception;

/** Background capacity is exhausted and work cannot be scheduled. */
public class ServiceUnavailableException extends JobHookException {
  public ServiceUnavailableException(String message) {
    super(JobHookErrorCode.SERVICE_UNAVAILABLE, message);
  }

  public ServiceUnavailableException(String message, Throwable cause) {
    super(JobHookErrorCode.SERVICE_UNAVAILABLE, message, cause);
  }
}
