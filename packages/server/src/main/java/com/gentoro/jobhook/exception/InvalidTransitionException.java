package com.gentoro.jobhook.exception;

/** Requested job state change is not allowed by the lifecycle. */
public class InvalidTransitionException extends JobHookException {
  public InvalidTransitionException(String message) {
    super(JobHookErrorCode.INVALID_TRANSITION, message);
  }
}
