package com.slack.dispatch.dispatcher;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

/** Meters shared by every session of a dispatcher. */
class DispatchMetrics {
  public static final String DISPATCH_PARTITIONS_SENT = "dispatch_partitions_sent";
  public static final String DISPATCH_PARTITIONS_COMPLETED = "dispatch_partitions_completed";
  public static final String DISPATCH_PARTITIONS_FAILED = "dispatch_partitions_failed";
  public static final String DISPATCH_PARTITIONS_TIMED_OUT = "dispatch_partitions_timed_out";
  public static final String DISPATCH_PARTITIONS_CANCELLED = "dispatch_partitions_cancelled";
  public static final String DISPATCH_PARTITION_DURATION_SECONDS =
      "dispatch_partition_duration_seconds";

  final Counter sent;
  private final Counter completed;
  private final Counter failed;
  private final Counter timedOut;
  private final Counter cancelled;
  private final Timer partitionDuration;

  DispatchMetrics(MeterRegistry meterRegistry) {
    this.sent = meterRegistry.counter(DISPATCH_PARTITIONS_SENT);
    this.completed = meterRegistry.counter(DISPATCH_PARTITIONS_COMPLETED);
    this.failed = meterRegistry.counter(DISPATCH_PARTITIONS_FAILED);
    this.timedOut = meterRegistry.counter(DISPATCH_PARTITIONS_TIMED_OUT);
    this.cancelled = meterRegistry.counter(DISPATCH_PARTITIONS_CANCELLED);
    this.partitionDuration = meterRegistry.timer(DISPATCH_PARTITION_DURATION_SECONDS);
  }

  void recordTerminal(PartitionStatus status, long durationNanos) {
    switch (status) {
      case COMPLETED -> completed.increment();
      case FAILED -> failed.increment();
      case TIMED_OUT -> timedOut.increment();
      case CANCELLED -> cancelled.increment();
      default -> throw new IllegalArgumentException("Not a terminal status " + status);
    }
    partitionDuration.record(durationNanos, TimeUnit.NANOSECONDS);
  }
}
