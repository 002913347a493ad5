package com.slack.dispatch.gateway;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.slack.dispatch.dispatcher.PartitionResult;
import com.slack.dispatch.dispatcher.QuerySession;
import com.slack.dispatch.dispatcher.SearchDispatcher;
import com.slack.dispatch.partition.FileKey;
import com.slack.dispatch.partition.FilePartition;
import com.slack.dispatch.partition.LocalityException;
import com.slack.dispatch.partition.PartitionAssigner;
import com.slack.dispatch.partition.PartitionAssignment;
import com.slack.dispatch.proto.service.DispatchSearch;
import com.slack.dispatch.proto.service.SearchDispatchServiceGrpc;
import com.slack.dispatch.request.QueryParams;
import com.slack.dispatch.request.SearchRequestBuilder;
import com.slack.dispatch.request.SearchRequests;
import com.slack.dispatch.request.ValidationException;
import com.slack.dispatch.util.ScanStatsUtil;
import io.grpc.Context;
import io.grpc.Deadline;
import io.grpc.Status;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Regional entry point of a super cluster query. It accepts the same calls as a worker, splits the
 * request's files over the workers of its own cluster, runs the resulting child partitions and
 * relays their rows back as a single stream. The call succeeds only if every child partition
 * completed, otherwise it ends with the status of the first child that did not.
 */
public class SuperClusterGatewayService
    extends SearchDispatchServiceGrpc.SearchDispatchServiceImplBase implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(SuperClusterGatewayService.class);

  public static final String GATEWAY_REQUESTS = "gateway_requests";
  public static final String GATEWAY_REQUESTS_FAILED = "gateway_requests_failed";
  public static final String GATEWAY_CHILD_PARTITIONS = "gateway_child_partitions";

  private static final Duration RESULT_POLL = Duration.ofMillis(100);

  private final PartitionAssigner partitionAssigner;
  private final SearchDispatcher dispatcher;
  private final ExecutorService executorService;
  private final Counter requests;
  private final Counter requestsFailed;
  private final Counter childPartitions;

  public SuperClusterGatewayService(
      PartitionAssigner partitionAssigner,
      SearchDispatcher dispatcher,
      int relayThreads,
      MeterRegistry meterRegistry) {
    this.partitionAssigner = partitionAssigner;
    this.dispatcher = dispatcher;
    this.executorService =
        Executors.newFixedThreadPool(
            relayThreads,
            new ThreadFactoryBuilder().setNameFormat("gateway-relay-%d").setDaemon(true).build());
    this.requests = meterRegistry.counter(GATEWAY_REQUESTS);
    this.requestsFailed = meterRegistry.counter(GATEWAY_REQUESTS_FAILED);
    this.childPartitions = meterRegistry.counter(GATEWAY_CHILD_PARTITIONS);
  }

  @Override
  public void search(
      DispatchSearch.SearchRequest request,
      StreamObserver<DispatchSearch.SearchResponse> responseObserver) {
    ServerCallStreamObserver<DispatchSearch.SearchResponse> serverObserver =
        (ServerCallStreamObserver<DispatchSearch.SearchResponse>) responseObserver;
    String logPrefix = SearchRequests.describe(request);
    requests.increment();

    List<DispatchSearch.SearchRequest> children;
    try {
      children = childRequests(request, budget(request));
    } catch (LocalityException e) {
      LOG.warn("{} can't be placed in this cluster: {}", logPrefix, e.getMessage());
      requestsFailed.increment();
      responseObserver.onError(Status.NOT_FOUND.withDescription(e.getMessage()).asException());
      return;
    } catch (ValidationException | IllegalArgumentException e) {
      LOG.warn("{} is invalid: {}", logPrefix, e.getMessage());
      requestsFailed.increment();
      responseObserver.onError(
          Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asException());
      return;
    } catch (BudgetExhaustedException e) {
      LOG.warn("{} arrived without any time left", logPrefix);
      requestsFailed.increment();
      responseObserver.onError(Status.DEADLINE_EXCEEDED.asException());
      return;
    }

    childPartitions.increment(children.size());
    QuerySession session = dispatcher.dispatch(children);
    Relay relay = new Relay(logPrefix, session, serverObserver);
    serverObserver.setOnCancelHandler(relay::onCancel);
    serverObserver.setOnReadyHandler(relay::onReady);
    try {
      executorService.execute(relay);
    } catch (RejectedExecutionException e) {
      session.cancel();
      requestsFailed.increment();
      responseObserver.onError(
          Status.UNAVAILABLE.withDescription("gateway is shutting down").asException());
    }
  }

  /**
   * Seconds left for the children, bounded by the request timeout and the call deadline. A partial
   * second left on the call counts as a whole one; the call deadline still applies to the children.
   */
  private static long budget(DispatchSearch.SearchRequest request)
      throws BudgetExhaustedException {
    if (request.getTimeout() <= 0) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    long budgetSecs = request.getTimeout();
    Deadline callDeadline = Context.current().getDeadline();
    if (callDeadline != null) {
      long remainingMs = callDeadline.timeRemaining(TimeUnit.MILLISECONDS);
      budgetSecs = Math.min(budgetSecs, remainingMs <= 0 ? 0 : (remainingMs + 999) / 1000);
    }
    if (budgetSecs <= 0) {
      throw new BudgetExhaustedException();
    }
    return budgetSecs;
  }

  private List<DispatchSearch.SearchRequest> childRequests(
      DispatchSearch.SearchRequest request, long budgetSecs)
      throws LocalityException, ValidationException {
    Map<Long, String> indexNames = new HashMap<>();
    request.getIdxFileListList().forEach(idx -> indexNames.put(idx.getFileId(), idx.getName()));
    List<FileKey> files = new ArrayList<>();
    for (long fileId : new LinkedHashSet<>(request.getFileIdListList())) {
      String indexName = indexNames.get(fileId);
      files.add(
          indexName == null
              ? FileKey.of(fileId, request.getOrgId(), request.getStreamType())
              : FileKey.withIndex(fileId, request.getOrgId(), request.getStreamType(), indexName));
    }

    PartitionAssignment assignment =
        partitionAssigner.assign(
            request.getOrgId(), request.getStreamType(), files, request.getUseInvertedIndex());
    QueryParams params =
        QueryParams.builderFrom(request).superCluster(false).timeoutSecs(budgetSecs).build();
    List<DispatchSearch.SearchRequest> children = new ArrayList<>(assignment.size());
    for (FilePartition partition : assignment.partitions) {
      children.add(SearchRequestBuilder.build(request.getPlan(), partition, params));
    }
    LOG.info(
        "[trace_id {}] split partition {} into {} child partitions",
        request.getTraceId(),
        request.getPartition(),
        children.size());
    return children;
  }

  @Override
  public void close() {
    executorService.shutdownNow();
  }

  /** Moves child results to the caller, one batch at a time as the caller's transport allows. */
  private class Relay implements Runnable {
    private final String logPrefix;
    private final QuerySession session;
    private final ServerCallStreamObserver<DispatchSearch.SearchResponse> responseObserver;
    private final Object readyLock = new Object();
    private volatile boolean cancelled = false;

    Relay(
        String logPrefix,
        QuerySession session,
        ServerCallStreamObserver<DispatchSearch.SearchResponse> responseObserver) {
      this.logPrefix = logPrefix;
      this.session = session;
      this.responseObserver = responseObserver;
    }

    @Override
    public void run() {
      List<DispatchSearch.ScanStats> childStats = new ArrayList<>();
      PartitionResult firstFailure = null;
      try {
        while (!session.isDone()) {
          if (!awaitReady()) {
            return;
          }
          Optional<PartitionResult> next = session.nextResult(RESULT_POLL);
          if (next.isEmpty()) {
            continue;
          }
          PartitionResult result = next.get();
          if (result instanceof PartitionResult.Batch batch) {
            responseObserver.onNext(
                DispatchSearch.SearchResponse.newBuilder().setBatch(batch.batch).build());
          } else if (result instanceof PartitionResult.Completed completed) {
            childStats.add(completed.stats);
          } else if (firstFailure == null) {
            firstFailure = result;
          }
        }
        if (cancelled) {
          return;
        }
        if (firstFailure != null) {
          LOG.warn("{} failed on child {}", logPrefix, firstFailure);
          requestsFailed.increment();
          responseObserver.onError(toStatus(firstFailure).asException());
          return;
        }
        responseObserver.onNext(
            DispatchSearch.SearchResponse.newBuilder()
                .setStats(ScanStatsUtil.sum(childStats))
                .build());
        responseObserver.onCompleted();
        LOG.info("{} completed over {} child partitions", logPrefix, childStats.size());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        session.cancel();
        responseObserver.onError(
            Status.CANCELLED.withDescription("gateway is shutting down").asException());
      } catch (RuntimeException e) {
        LOG.error("{} relay failed", logPrefix, e);
        session.cancel();
        requestsFailed.increment();
        responseObserver.onError(Status.INTERNAL.withDescription(e.getMessage()).asException());
      }
    }

    /** Returns false if the caller went away while waiting. */
    private boolean awaitReady() throws InterruptedException {
      synchronized (readyLock) {
        while (!cancelled && !responseObserver.isReady()) {
          readyLock.wait(RESULT_POLL.toMillis());
        }
      }
      return !cancelled;
    }

    void onCancel() {
      cancelled = true;
      LOG.info("{} cancelled by the caller", logPrefix);
      session.cancel();
      onReady();
    }

    void onReady() {
      synchronized (readyLock) {
        readyLock.notifyAll();
      }
    }
  }

  private static Status toStatus(PartitionResult result) {
    if (result instanceof PartitionResult.Failed failed) {
      return failed.grpcStatus;
    } else if (result instanceof PartitionResult.TimedOut) {
      return Status.DEADLINE_EXCEEDED.withDescription("child partition " + result.partition);
    } else if (result instanceof PartitionResult.Cancelled) {
      return Status.CANCELLED.withDescription("child partition " + result.partition);
    }
    return Status.INTERNAL.withDescription("unexpected child result " + result);
  }

  private static class BudgetExhaustedException extends Exception {}
}
