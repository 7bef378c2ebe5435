package com.gentoro.jobhook.exception;

/** Inbound payload exceeds the configured size limit. */
public class PayloadTooLargeException extends JobHookException {
  public PayloadTooLargeException(String message) {
    super(JobHookErrorCode.PAYLOAD_TOO_LARGE, message);
  }
}
