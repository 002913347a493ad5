package com.slack.dispatch.dispatcher;

import com.slack.dispatch.proto.service.DispatchSearch;
import io.grpc.Status;

/**
 * An event of a partition call: a batch of rows, or the single terminal event that ends the
 * partition.
 */
public abstract class PartitionResult {
  public final int partition;

  protected PartitionResult(int partition) {
    this.partition = partition;
  }

  public abstract PartitionStatus status();

  public boolean isTerminal() {
    return status().isTerminal();
  }

  /** Maps the status a partition call closed with to the terminal event of the partition. */
  public static PartitionResult fromStatus(int partition, Status status) {
    switch (status.getCode()) {
      case OK:
        return new Completed(partition, DispatchSearch.ScanStats.getDefaultInstance());
      case INVALID_ARGUMENT:
        return new Failed(partition, FailureReason.DECODE, false, status);
      case NOT_FOUND:
        return new Failed(partition, FailureReason.LOCALITY, false, status);
      case DEADLINE_EXCEEDED:
        return new TimedOut(partition);
      case CANCELLED:
        return new Cancelled(partition);
      case UNAVAILABLE:
      case ABORTED:
      case RESOURCE_EXHAUSTED:
        return new Failed(partition, FailureReason.TRANSPORT, true, status);
      default:
        return new Failed(partition, FailureReason.INTERNAL, false, status);
    }
  }

  public static final class Batch extends PartitionResult {
    public final DispatchSearch.RowBatch batch;

    public Batch(int partition, DispatchSearch.RowBatch batch) {
      super(partition);
      this.batch = batch;
    }

    @Override
    public PartitionStatus status() {
      return PartitionStatus.STREAMING;
    }

    @Override
    public String toString() {
      return "Batch{partition=" + partition + ", rows=" + batch.getRowsCount() + '}';
    }
  }

  public static final class Completed extends PartitionResult {
    public final DispatchSearch.ScanStats stats;

    public Completed(int partition, DispatchSearch.ScanStats stats) {
      super(partition);
      this.stats = stats;
    }

    @Override
    public PartitionStatus status() {
      return PartitionStatus.COMPLETED;
    }

    @Override
    public String toString() {
      return "Completed{partition=" + partition + ", rows=" + stats.getRows() + '}';
    }
  }

  public static final class Failed extends PartitionResult {
    public final FailureReason reason;
    // a hint for the caller, the dispatcher never retries on its own
    public final boolean retriable;
    public final Status grpcStatus;

    public Failed(int partition, FailureReason reason, boolean retriable, Status grpcStatus) {
      super(partition);
      this.reason = reason;
      this.retriable = retriable;
      this.grpcStatus = grpcStatus;
    }

    @Override
    public PartitionStatus status() {
      return PartitionStatus.FAILED;
    }

    @Override
    public String toString() {
      return "Failed{"
          + "partition="
          + partition
          + ", reason="
          + reason
          + ", retriable="
          + retriable
          + ", status="
          + grpcStatus
          + '}';
    }
  }

  public static final class TimedOut extends PartitionResult {

    public TimedOut(int partition) {
      super(partition);
    }

    @Override
    public PartitionStatus status() {
      return PartitionStatus.TIMED_OUT;
    }

    @Override
    public String toString() {
      return "TimedOut{partition=" + partition + '}';
    }
  }

  public static final class Cancelled extends PartitionResult {

    public Cancelled(int partition) {
      super(partition);
    }

    @Override
    public PartitionStatus status() {
      return PartitionStatus.CANCELLED;
    }

    @Override
    public String toString() {
      return "Cancelled{partition=" + partition + '}';
    }
  }
}
