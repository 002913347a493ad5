package com.slack.dispatch.dispatcher;

import java.util.Map;

/** A query did not satisfy its completion policy. Carries the terminal event of every failure. */
public class PartitionFailureException extends Exception {
  public final String traceId;
  public final Map<Integer, PartitionResult> failures;

  public PartitionFailureException(String traceId, Map<Integer, PartitionResult> failures) {
    super(String.format("Query %s failed on partitions %s", traceId, failures.values()));
    this.traceId = traceId;
    this.failures = Map.copyOf(failures);
  }
}
