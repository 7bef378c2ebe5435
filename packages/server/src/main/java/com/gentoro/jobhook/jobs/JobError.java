package com.gentoro.jobhook.jobs;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.jobhook.exception.JobHookErrorCode;

/** Terminal failure recorded on a job and relayed in the callback envelope. */
public record JobError(
    @JsonProperty("code") JobHookErrorCode code, @JsonProperty("message") String message) {}
