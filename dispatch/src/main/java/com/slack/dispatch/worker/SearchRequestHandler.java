package com.slack.dispatch.worker;

import brave.ScopedSpan;
import brave.Tracing;
import com.google.common.annotations.VisibleForTesting;
import com.slack.dispatch.plan.PlanDecodeException;
import com.slack.dispatch.plan.ScanNode;
import com.slack.dispatch.plan.ScanPlanCodec;
import com.slack.dispatch.plan.SchemaField;
import com.slack.dispatch.proto.service.DispatchSearch;
import com.slack.dispatch.request.SearchRequests;
import com.slack.dispatch.storage.FileStore;
import com.slack.dispatch.storage.IndexStore;
import com.slack.dispatch.storage.RowScanner;
import com.slack.dispatch.storage.ScanRow;
import com.slack.dispatch.storage.TermIndex;
import com.slack.dispatch.storage.TermTokenizer;
import io.grpc.Context;
import io.grpc.Deadline;
import io.grpc.Status;
import io.grpc.stub.ServerCallStreamObserver;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes one search request on a worker and streams its rows back.
 *
 * <p>The request moves through {@link RequestState}s. Any thread may end it (the handler itself,
 * or the transport when the caller cancels), but the terminal state is set exactly once and only
 * the thread that set it answers the call. The handler checks for cancellation and for the end of
 * its time budget at every state change and between rows, and waits for the transport to become
 * ready before every batch so it never holds more than one batch in memory.
 */
public class SearchRequestHandler implements Runnable {
  private static final Logger LOG = LoggerFactory.getLogger(SearchRequestHandler.class);

  // upper bound of a single wait for the transport, the budget is rechecked after every wait
  private static final long READY_POLL_MS = 100;

  private final DispatchSearch.SearchRequest request;
  private final ServerCallStreamObserver<DispatchSearch.SearchResponse> responseObserver;
  private final FileStore fileStore;
  private final IndexStore indexStore;
  private final int batchSize;
  private final WorkerMetrics metrics;
  private final String logPrefix;
  private final long receivedNanos = System.nanoTime();
  private final Deadline deadline;

  private final AtomicReference<RequestState> state = new AtomicReference<>(RequestState.RECEIVED);
  private final List<RequestState> transitions = new CopyOnWriteArrayList<>();
  private final Object readyLock = new Object();

  private final DispatchSearch.ScanStats.Builder stats = DispatchSearch.ScanStats.newBuilder();
  private final List<DispatchSearch.Row> pendingRows = new ArrayList<>();
  private long rowsEmitted = 0;

  /**
   * Must be created on the thread that invoked the service method, since it registers the cancel
   * and ready handlers of the call.
   */
  SearchRequestHandler(
      DispatchSearch.SearchRequest request,
      ServerCallStreamObserver<DispatchSearch.SearchResponse> responseObserver,
      FileStore fileStore,
      IndexStore indexStore,
      int batchSize,
      WorkerMetrics metrics) {
    this.request = request;
    this.responseObserver = responseObserver;
    this.fileStore = fileStore;
    this.indexStore = indexStore;
    this.batchSize = batchSize;
    this.metrics = metrics;
    this.logPrefix = SearchRequests.describe(request);
    this.deadline = budget(request, Context.current().getDeadline());
    transitions.add(RequestState.RECEIVED);

    responseObserver.setOnCancelHandler(this::onCancel);
    responseObserver.setOnReadyHandler(this::onReady);
  }

  private static Deadline budget(DispatchSearch.SearchRequest request, Deadline callDeadline) {
    Deadline budget = Deadline.after(Math.max(request.getTimeout(), 0), TimeUnit.SECONDS);
    return callDeadline == null ? budget : budget.minimum(callDeadline);
  }

  public RequestState getState() {
    return state.get();
  }

  @VisibleForTesting
  List<RequestState> getTransitions() {
    return List.copyOf(transitions);
  }

  @Override
  public void run() {
    ScopedSpan span = Tracing.currentTracer().startScopedSpan("SearchRequestHandler.run");
    span.tag("traceId", request.getTraceId());
    span.tag("partition", String.valueOf(request.getPartition()));
    try {
      execute();
    } catch (RequestEndedException e) {
      LOG.info("{} stopped in state {}", logPrefix, state.get());
    } catch (PlanDecodeException e) {
      LOG.warn("{} has an invalid plan", logPrefix, e);
      fail(Status.INVALID_ARGUMENT.withDescription(e.getMessage()));
    } catch (FileNotFoundException e) {
      LOG.warn("{} is not local to this worker: {}", logPrefix, e.getMessage());
      fail(Status.NOT_FOUND.withDescription(e.getMessage()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn("{} interrupted", logPrefix);
      terminate(RequestState.CANCELLED, Status.CANCELLED.withDescription("worker shutting down"));
    } catch (Exception e) {
      LOG.error("{} failed", logPrefix, e);
      span.error(e);
      fail(Status.INTERNAL.withDescription(e.getMessage()));
    } finally {
      span.tag("state", state.get().name());
      span.finish();
    }
  }

  /** Ends a request that could not be scheduled on a worker thread. */
  void reject(Status status) {
    terminate(RequestState.FAILED, status);
  }

  private void execute() throws Exception {
    if (request.getTimeout() <= 0) {
      LOG.warn("{} has no time budget", logPrefix);
      fail(Status.INVALID_ARGUMENT.withDescription("timeout must be positive"));
      return;
    }
    transition(RequestState.DECODING);
    ScanNode scanNode = ScanPlanCodec.decode(request.getPlan()).scanNode();

    List<Long> files = bind();
    transition(RequestState.BOUND);

    transition(RequestState.EXECUTING);
    Map<String, String> equalKeys = SearchRequests.effectiveEqualKeys(request);
    List<String> matchAllTokens = new ArrayList<>();
    for (String matchAllKey : request.getMatchAllKeysList()) {
      matchAllTokens.addAll(TermTokenizer.tokenize(matchAllKey));
    }
    Optional<Long> limit = scanNode.getLimit();

    for (long fileId : files) {
      if (limit.isPresent() && rowsEmitted + pendingRows.size() >= limit.get()) {
        break;
      }
      scanFile(fileId, scanNode, equalKeys, matchAllTokens, limit);
      stats.setFiles(stats.getFiles() + 1);
    }

    flush();
    stats.setRows(rowsEmitted);
    stats.setTookMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - receivedNanos));
    enterStreaming();
    awaitReady();
    responseObserver.onNext(DispatchSearch.SearchResponse.newBuilder().setStats(stats).build());
    if (terminate(RequestState.COMPLETED, null)) {
      LOG.info("{} completed with {} rows from {} files", logPrefix, rowsEmitted, files.size());
    }
  }

  /**
   * Resolves every file of the request through the file store, then drops the files whose
   * inverted index proves that no row can match.
   */
  private List<Long> bind() throws IOException, RequestEndedException {
    for (long fileId : request.getFileIdListList()) {
      if (!fileStore.contains(fileId)) {
        throw new FileNotFoundException("file " + fileId + " is not held by this worker");
      }
    }
    if (!request.getUseInvertedIndex() || request.getIdxFileListCount() == 0) {
      return request.getFileIdListList();
    }

    long idxStart = System.nanoTime();
    Map<Long, String> indexByFile = new LinkedHashMap<>();
    request.getIdxFileListList().forEach(idx -> indexByFile.put(idx.getFileId(), idx.getName()));
    Map<String, String> equalKeys = SearchRequests.effectiveEqualKeys(request);

    List<Long> kept = new ArrayList<>();
    for (long fileId : request.getFileIdListList()) {
      checkpoint();
      String indexName = indexByFile.get(fileId);
      if (indexName == null) {
        kept.add(fileId);
        continue;
      }
      try {
        Optional<TermIndex> index = indexStore.find(indexName);
        if (index.isEmpty()) {
          kept.add(fileId);
          continue;
        }
        stats.setIdxFiles(stats.getIdxFiles() + 1);
        if (index.get().mayMatch(equalKeys, request.getMatchAllKeysList())) {
          kept.add(fileId);
        } else {
          stats.setFilesPruned(stats.getFilesPruned() + 1);
          metrics.filesPruned.increment();
        }
      } catch (IOException | RuntimeException e) {
        LOG.warn("{} could not load index {}, scanning file {}", logPrefix, indexName, fileId, e);
        kept.add(fileId);
      }
    }
    stats.setIdxTookMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - idxStart));
    LOG.debug(
        "{} kept {} of {} files after index pruning",
        logPrefix,
        kept.size(),
        request.getFileIdListCount());
    return kept;
  }

  private void scanFile(
      long fileId,
      ScanNode scanNode,
      Map<String, String> equalKeys,
      List<String> matchAllTokens,
      Optional<Long> limit)
      throws IOException, RequestEndedException, InterruptedException {
    List<ScanRow> unsorted = scanNode.sortedByTime ? null : new ArrayList<>();
    try (RowScanner scanner = fileStore.openScanner(fileId)) {
      ScanRow row;
      while ((row = scanner.next()) != null) {
        checkpoint();
        stats.setRecords(stats.getRecords() + 1);
        if (!matches(row, scanNode, equalKeys, matchAllTokens)) {
          continue;
        }
        if (unsorted != null) {
          unsorted.add(row);
        } else if (!emit(row, scanNode, limit)) {
          return;
        }
      }
    }
    if (unsorted != null) {
      unsorted.sort(Comparator.comparingLong(r -> r.timestamp));
      for (ScanRow row : unsorted) {
        checkpoint();
        if (!emit(row, scanNode, limit)) {
          return;
        }
      }
    }
  }

  private boolean matches(
      ScanRow row, ScanNode scanNode, Map<String, String> equalKeys, List<String> matchAllTokens) {
    if (row.timestamp < request.getStartTime() || row.timestamp >= request.getEndTime()) {
      return false;
    }
    for (Map.Entry<String, String> equalKey : equalKeys.entrySet()) {
      Object value = row.get(equalKey.getKey());
      if (value == null || !TermIndex.stringValue(value).equals(equalKey.getValue())) {
        return false;
      }
    }
    if (!matchAllTokens.isEmpty()) {
      Set<String> rowTokens = TermTokenizer.tokenize(row);
      if (!rowTokens.containsAll(matchAllTokens)) {
        return false;
      }
    }
    return scanNode.matches(row);
  }

  /** Adds a row to the current batch. Returns false once the limit is reached. */
  private boolean emit(ScanRow row, ScanNode scanNode, Optional<Long> limit)
      throws RequestEndedException, InterruptedException {
    if (limit.isPresent() && rowsEmitted + pendingRows.size() >= limit.get()) {
      return false;
    }
    pendingRows.add(toRow(row, scanNode.outputSchema()));
    if (pendingRows.size() >= batchSize) {
      flush();
    }
    return limit.isEmpty() || rowsEmitted + pendingRows.size() < limit.get();
  }

  private void flush() throws RequestEndedException, InterruptedException {
    if (pendingRows.isEmpty()) {
      return;
    }
    enterStreaming();
    awaitReady();
    responseObserver.onNext(
        DispatchSearch.SearchResponse.newBuilder()
            .setBatch(DispatchSearch.RowBatch.newBuilder().addAllRows(pendingRows))
            .build());
    rowsEmitted += pendingRows.size();
    metrics.rowsStreamed.increment(pendingRows.size());
    pendingRows.clear();
  }

  static DispatchSearch.Row toRow(ScanRow row, List<SchemaField> columns) {
    DispatchSearch.Row.Builder builder =
        DispatchSearch.Row.newBuilder().setTimestamp(row.timestamp);
    for (SchemaField column : columns) {
      builder.addValues(toValue(row.get(column.name)));
    }
    return builder.build();
  }

  private static DispatchSearch.Value toValue(Object value) {
    DispatchSearch.Value.Builder builder = DispatchSearch.Value.newBuilder();
    if (value instanceof String s) {
      builder.setStringValue(s);
    } else if (value instanceof Boolean b) {
      builder.setBoolValue(b);
    } else if (value instanceof Double || value instanceof Float) {
      builder.setDoubleValue(((Number) value).doubleValue());
    } else if (value instanceof Number n) {
      builder.setLongValue(n.longValue());
    } else if (value != null) {
      builder.setStringValue(value.toString());
    }
    // a missing column is sent as a value with nothing set
    return builder.build();
  }

  private void awaitReady() throws RequestEndedException, InterruptedException {
    synchronized (readyLock) {
      while (!responseObserver.isReady()) {
        checkpoint();
        long remainingMs = Math.max(1, deadline.timeRemaining(TimeUnit.MILLISECONDS));
        readyLock.wait(Math.min(remainingMs, READY_POLL_MS));
      }
    }
    checkpoint();
  }

  private void enterStreaming() throws RequestEndedException {
    if (state.get() != RequestState.STREAMING) {
      transition(RequestState.STREAMING);
    }
  }

  private void transition(RequestState next) throws RequestEndedException {
    checkpoint();
    RequestState current = state.get();
    if (current.isTerminal() || !state.compareAndSet(current, next)) {
      throw new RequestEndedException();
    }
    transitions.add(next);
  }

  /** Stops the handler if the request already ended or ran out of time. */
  private void checkpoint() throws RequestEndedException {
    if (state.get().isTerminal()) {
      throw new RequestEndedException();
    }
    if (deadline.isExpired()) {
      if (terminate(
          RequestState.TIMED_OUT,
          Status.DEADLINE_EXCEEDED.withDescription(
              "search did not finish within " + request.getTimeout() + "s"))) {
        LOG.warn("{} timed out after {} rows", logPrefix, rowsEmitted);
      }
      throw new RequestEndedException();
    }
  }

  private void fail(Status status) {
    terminate(RequestState.FAILED, status);
  }

  /**
   * Moves the request to a terminal state if no other thread did so first, and answers the call:
   * completes it for {@code COMPLETED}, closes it with {@code status} otherwise. A null status
   * leaves the call alone.
   */
  private boolean terminate(RequestState terminal, Status status) {
    RequestState current;
    do {
      current = state.get();
      if (current.isTerminal()) {
        return false;
      }
    } while (!state.compareAndSet(current, terminal));

    transitions.add(terminal);
    metrics.recordTerminal(terminal, System.nanoTime() - receivedNanos);
    if (terminal == RequestState.COMPLETED) {
      responseObserver.onCompleted();
    } else if (status != null) {
      responseObserver.onError(status.asRuntimeException());
    }
    wakeUp();
    return true;
  }

  private void onCancel() {
    // the transport cancels the call itself once the call deadline passes
    RequestState terminal =
        deadline.isExpired() ? RequestState.TIMED_OUT : RequestState.CANCELLED;
    if (terminate(terminal, null)) {
      LOG.info("{} ended by the caller as {}", logPrefix, terminal);
    }
  }

  private void onReady() {
    wakeUp();
  }

  private void wakeUp() {
    synchronized (readyLock) {
      readyLock.notifyAll();
    }
  }

  /** Unwinds the handler once the request reached a terminal state. */
  private static class RequestEndedException extends Exception {
    RequestEndedException() {
      super(null, null, false, false);
    }
  }
}
