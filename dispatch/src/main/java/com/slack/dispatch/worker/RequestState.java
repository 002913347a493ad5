package com.slack.dispatch.worker;

/** States a search request passes through on a worker. */
public enum RequestState {
  RECEIVED,
  DECODING,
  BOUND,
  EXECUTING,
  STREAMING,
  COMPLETED,
  FAILED,
  TIMED_OUT,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == TIMED_OUT || this == CANCELLED;
  }
}
