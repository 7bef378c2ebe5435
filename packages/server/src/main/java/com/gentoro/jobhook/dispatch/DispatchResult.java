package com.gentoro.jobhook.dispatch;

import com.fasterxml.jackson.databind.node.ObjectNode;

/** Outcome of an accepted webhook. Failures are reported as exceptions instead. */
public interface DispatchResult {

  String jobId();

  /** Synchronous request: the analysis ran inline. */
  record SyncResult(String jobId, ObjectNode result) implements DispatchResult {}

  /** Asynchronous request: the job was recorded and scheduled. */
  record AsyncAccepted(String jobId) implements DispatchResult {}
}
