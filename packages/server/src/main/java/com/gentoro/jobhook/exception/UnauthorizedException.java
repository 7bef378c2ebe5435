package com.gentoro.jobhook.exception;

/** Inbound request failed signature verification. */
public class UnauthorizedException extends JobHookException {
  public UnauthorizedException(String message) {
    super(JobHookErrorCode.UNAUTHORIZED, message);
  }
}
