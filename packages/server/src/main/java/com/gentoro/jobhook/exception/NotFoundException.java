package com.gentoro.jobhook.exception;

/** No job exists for the requested identifier. */
public class NotFoundException extends JobHookException {
  public NotFoundException(String message) {
    super(JobHookErrorCode.NOT_FOUND, message);
  }
}
