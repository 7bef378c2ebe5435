package com.gentoro.jobhook.exception;

/** Invalid or missing configuration. */
public class ConfigException extends JobHookException {
  public ConfigException(String message) {
    super(JobHookErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(JobHookErrorCode.CONFIG_ERROR, message, cause);
  }
}
