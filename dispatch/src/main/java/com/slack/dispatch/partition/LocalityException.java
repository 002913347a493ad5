package com.slack.dispatch.partition;

/**
 * Raised when a data file can't be matched with the worker expected to hold it. The assigner is
 * supposed to guarantee locality, so this points at a stale topology rather than a bad request.
 */
public class LocalityException extends Exception {

  public LocalityException(String message) {
    super(message);
  }
}
