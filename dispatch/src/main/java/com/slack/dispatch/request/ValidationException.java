package com.slack.dispatch.request;

/** A search request could not be constructed from the supplied parameters and is never sent. */
public class ValidationException extends Exception {

  public ValidationException(String message) {
    super(message);
  }
}
