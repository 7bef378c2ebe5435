package com.gentoro.jobhook.exception;

/** Component used in an invalid lifecycle state. */
public class StateException extends JobHookException {
  public StateException(String message) {
    super(JobHookErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(JobHookErrorCode.STATE_ERROR, message, cause);
  }
}
