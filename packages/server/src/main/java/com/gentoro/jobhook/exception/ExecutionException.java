package com.gentoro.jobhook.exception;

/** Failures while starting or running application components. */
public class ExecutionException extends JobHookException {
  public ExecutionException(String message, Throwable cause) {
    super(JobHookErrorCode.STATE_ERROR, message, cause);
  }
}
