package com.gentoro.jobhook.exception;

/** Inbound payload is structurally invalid. */
public class BadRequestException extends JobHookException {
  public BadRequestException(String message) {
    super(JobHookErrorCode.BAD_REQUEST, message);
  }
}
