package com.slack.dispatch.plan;

/** Thrown when encoded plan bytes are corrupt, truncated or of a version this node can't run. */
public class PlanDecodeException extends Exception {

  public PlanDecodeException(String message) {
    super(message);
  }

  public PlanDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
