package com.gentoro.jobhook.exception;

/** Stable error codes surfaced in logs and error payloads. */
public enum JobHookErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  STATE_ERROR,
  UNAUTHORIZED,
  BAD_REQUEST,
  PAYLOAD_TOO_LARGE,
  CONFLICT,
  NOT_FOUND,
  INVALID_TRANSITION,
  SERVICE_UNAVAILABLE,
  UPSTREAM_UNAVAILABLE,
  UPSTREAM_TIMEOUT,
  UPSTREAM_INVALID_RESPONSE,
  NETWORK_ERROR
}
