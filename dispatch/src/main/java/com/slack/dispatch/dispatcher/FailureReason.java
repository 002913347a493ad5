package com.slack.dispatch.dispatcher;

public enum FailureReason {
  // the worker could not decode the plan or rejected the request
  DECODE,
  // the worker does not hold a file of the partition, or no worker does
  LOCALITY,
  TRANSPORT,
  INTERNAL
}
