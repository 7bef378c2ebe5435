package com.gentoro.jobhook.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Root of all application exceptions. Carries an error code and optional structured context. */
public class JobHookException extends RuntimeException {
  private final JobHookErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public JobHookException(JobHookErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public JobHookException(JobHookErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public JobHookErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry, returning {@code this} for chaining. */
  public JobHookException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
