package com.slack.dispatch.dispatcher;

/** Lifecycle of one partition call as seen by the dispatching side. */
public enum PartitionStatus {
  PENDING,
  STREAMING,
  COMPLETED,
  FAILED,
  TIMED_OUT,
  CANCELLED;

  public boolean isTerminal() {
    return this != PENDING && this != STREAMING;
  }
}
