package com.gentoro.jobhook.exception;

/** Failures while binding or operating network listeners. */
public class NetworkException extends JobHookException {
  public NetworkException(String message) {
    super(JobHookErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(JobHookErrorCode.NETWORK_ERROR, message, cause);
  }
}
