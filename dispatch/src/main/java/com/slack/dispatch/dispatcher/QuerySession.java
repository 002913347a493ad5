package com.slack.dispatch.dispatcher;

import com.slack.dispatch.cluster.DispatchTarget;
import com.slack.dispatch.proto.config.DispatchConfigs;
import com.slack.dispatch.proto.service.DispatchSearch;
import com.slack.dispatch.proto.service.SearchDispatchServiceGrpc;
import io.grpc.Status;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The in-flight state of one dispatched query. Every partition is an independent call; results of
 * all partitions are merged into a single stream of {@link PartitionResult} events, where the
 * events of one partition keep their order and its terminal event comes last.
 *
 * <p>Calls use manual inbound flow control. A partition has at most one batch waiting in the
 * session, the next one is only requested from the worker when the consumer takes it through
 * {@link #nextResult(Duration)}.
 */
public class QuerySession {
  private static final Logger LOG = LoggerFactory.getLogger(QuerySession.class);

  public final String traceId;
  private final DispatchConfigs.CompletionPolicy defaultPolicy;
  private final DispatchMetrics metrics;
  private final Map<Integer, PartitionCall> calls = new TreeMap<>();
  private final LinkedBlockingQueue<PartitionResult> results = new LinkedBlockingQueue<>();
  private final Map<Integer, PartitionResult> terminalResults = new HashMap<>();
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private CountDownLatch remaining;

  QuerySession(
      String traceId, DispatchConfigs.CompletionPolicy defaultPolicy, DispatchMetrics metrics) {
    this.traceId = traceId;
    this.defaultPolicy = defaultPolicy;
    this.metrics = metrics;
  }

  PartitionCall addCall(DispatchSearch.SearchRequest request, DispatchTarget target) {
    PartitionCall call = new PartitionCall(request, target);
    calls.put(request.getPartition(), call);
    return call;
  }

  /** Must be called once all calls are added and before any of them starts. */
  void seal() {
    remaining = new CountDownLatch(calls.size());
  }

  /**
   * Waits up to {@code timeout} for the next event of any partition. Taking a batch asks its
   * partition for the next message.
   */
  public Optional<PartitionResult> nextResult(Duration timeout) throws InterruptedException {
    PartitionResult result = results.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    if (result instanceof PartitionResult.Batch) {
      calls.get(result.partition).ack();
    }
    return Optional.ofNullable(result);
  }

  /**
   * Consumes events until every partition reached a terminal state and all events were taken, or
   * the timeout elapsed.
   */
  public List<PartitionResult> drain(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    List<PartitionResult> drained = new ArrayList<>();
    while (!isDone()) {
      long left = deadline - System.nanoTime();
      if (left <= 0) {
        break;
      }
      nextResult(Duration.ofNanos(left)).ifPresent(drained::add);
    }
    return drained;
  }

  /**
   * Waits until every partition reached a terminal state. Batches that nobody takes hold their
   * partition back, so a caller that does not consume results should use {@link #drain(Duration)}.
   */
  public boolean awaitCompletion(Duration timeout) throws InterruptedException {
    return remaining.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  public boolean isDone() {
    return remaining.getCount() == 0 && results.isEmpty();
  }

  /** Cancels every partition that has not finished yet. Calling it again has no effect. */
  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    LOG.info("[trace_id {}] cancelling query", traceId);
    calls.values().forEach(PartitionCall::cancel);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public Map<Integer, PartitionStatus> statuses() {
    Map<Integer, PartitionStatus> statuses = new TreeMap<>();
    calls.forEach((partition, call) -> statuses.put(partition, call.status.get()));
    return statuses;
  }

  public QueryOutcome outcome() {
    return outcome(defaultPolicy);
  }

  public QueryOutcome outcome(DispatchConfigs.CompletionPolicy policy) {
    Map<Integer, PartitionResult> failures = new HashMap<>();
    Map<Integer, DispatchSearch.ScanStats> stats = new HashMap<>();
    synchronized (terminalResults) {
      terminalResults.forEach(
          (partition, result) -> {
            if (result instanceof PartitionResult.Completed completed) {
              stats.put(partition, completed.stats);
            } else {
              failures.put(partition, result);
            }
          });
    }
    return new QueryOutcome(traceId, policy, statuses(), failures, stats);
  }

  /** One partition: the request, where it goes, and the call's observer. */
  class PartitionCall
      implements ClientResponseObserver<
          DispatchSearch.SearchRequest, DispatchSearch.SearchResponse> {
    final DispatchSearch.SearchRequest request;
    final DispatchTarget target;
    final AtomicReference<PartitionStatus> status = new AtomicReference<>(PartitionStatus.PENDING);
    // reset when the call goes out; calls that never start are timed from creation
    private volatile long startNanos = System.nanoTime();
    private volatile ClientCallStreamObserver<DispatchSearch.SearchRequest> requestStream;
    private volatile DispatchSearch.ScanStats stats = DispatchSearch.ScanStats.getDefaultInstance();

    PartitionCall(DispatchSearch.SearchRequest request, DispatchTarget target) {
      this.request = request;
      this.target = target;
    }

    int partition() {
      return request.getPartition();
    }

    @Override
    public void beforeStart(ClientCallStreamObserver<DispatchSearch.SearchRequest> requestStream) {
      this.requestStream = requestStream;
      requestStream.disableAutoRequestWithInitial(1);
    }

    @Override
    public void onNext(DispatchSearch.SearchResponse response) {
      switch (response.getResponseCase()) {
        case BATCH -> {
          status.compareAndSet(PartitionStatus.PENDING, PartitionStatus.STREAMING);
          results.add(new PartitionResult.Batch(partition(), response.getBatch()));
        }
        case STATS -> {
          stats = response.getStats();
          requestStream.request(1);
        }
        default -> requestStream.request(1);
      }
    }

    @Override
    public void onError(Throwable t) {
      Status grpcStatus = Status.fromThrowable(t);
      PartitionResult result = PartitionResult.fromStatus(partition(), grpcStatus);
      if (result instanceof PartitionResult.Failed) {
        LOG.warn(
            "[trace_id {}] partition {} on {} failed with {}",
            traceId,
            partition(),
            target,
            grpcStatus);
      } else {
        LOG.info(
            "[trace_id {}] partition {} on {} ended with {}",
            traceId,
            partition(),
            target,
            result.status());
      }
      finish(result);
    }

    @Override
    public void onCompleted() {
      LOG.debug(
          "[trace_id {}] partition {} completed with {} rows",
          traceId,
          partition(),
          stats.getRows());
      finish(new PartitionResult.Completed(partition(), stats));
    }

    void start(SearchDispatchServiceGrpc.SearchDispatchServiceStub stub) {
      if (status.get().isTerminal()) {
        return;
      }
      startNanos = System.nanoTime();
      stub.search(request, this);
      if (cancelled.get()) {
        // the query was cancelled while this call was being started
        cancel();
      }
    }

    /** Ends a partition that never reached a worker. */
    void fail(PartitionResult.Failed result) {
      finish(result);
    }

    void ack() {
      if (!status.get().isTerminal() && requestStream != null) {
        requestStream.request(1);
      }
    }

    void cancel() {
      ClientCallStreamObserver<DispatchSearch.SearchRequest> stream = requestStream;
      if (stream != null) {
        // no-op on a finished call, otherwise onError follows with CANCELLED
        stream.cancel("Query " + traceId + " cancelled", null);
      } else {
        finish(new PartitionResult.Cancelled(partition()));
      }
    }

    private void finish(PartitionResult result) {
      PartitionStatus current;
      do {
        current = status.get();
        if (current.isTerminal()) {
          return;
        }
      } while (!status.compareAndSet(current, result.status()));

      synchronized (terminalResults) {
        terminalResults.put(partition(), result);
      }
      results.add(result);
      metrics.recordTerminal(result.status(), System.nanoTime() - startNanos);
      remaining.countDown();
    }
  }
}
