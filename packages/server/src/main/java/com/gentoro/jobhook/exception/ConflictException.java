package com.gentoro.jobhook.exception;

/** A job with the same identifier already exists. */
public class ConflictException extends JobHookException {
  public ConflictException(String message) {
    super(JobHookErrorCode.CONFLICT, message);
  }
}
