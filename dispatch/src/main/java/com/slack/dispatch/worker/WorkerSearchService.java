package com.slack.dispatch.worker;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.slack.dispatch.proto.config.DispatchConfigs;
import com.slack.dispatch.proto.service.DispatchSearch;
import com.slack.dispatch.proto.service.SearchDispatchServiceGrpc;
import com.slack.dispatch.storage.FileStore;
import com.slack.dispatch.storage.IndexStore;
import com.slack.dispatch.storage.JsonIndexStore;
import com.slack.dispatch.storage.JsonLinesFileStore;
import io.grpc.Status;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.Closeable;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker side of the search protocol. Every call is handled by a {@link SearchRequestHandler} on a
 * bounded pool, so the transport threads never block on a scan.
 */
public class WorkerSearchService extends SearchDispatchServiceGrpc.SearchDispatchServiceImplBase
    implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(WorkerSearchService.class);

  private final FileStore fileStore;
  private final IndexStore indexStore;
  private final int batchSize;
  private final ExecutorService executorService;
  private final WorkerMetrics metrics;

  public WorkerSearchService(
      FileStore fileStore,
      IndexStore indexStore,
      int batchSize,
      int handlerThreads,
      MeterRegistry meterRegistry) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
    }
    this.fileStore = fileStore;
    this.indexStore = indexStore;
    this.batchSize = batchSize;
    this.metrics = new WorkerMetrics(meterRegistry);
    this.executorService =
        Executors.newFixedThreadPool(
            handlerThreads,
            new ThreadFactoryBuilder().setNameFormat("search-handler-%d").setDaemon(true).build());
  }

  public static WorkerSearchService fromConfig(
      DispatchConfigs.WorkerConfig workerConfig, MeterRegistry meterRegistry) {
    return new WorkerSearchService(
        new JsonLinesFileStore(Path.of(workerConfig.getDataDirectory())),
        new JsonIndexStore(Path.of(workerConfig.getIndexDirectory())),
        workerConfig.getBatchSize(),
        workerConfig.getHandlerThreads(),
        meterRegistry);
  }

  @Override
  public void search(
      DispatchSearch.SearchRequest request,
      StreamObserver<DispatchSearch.SearchResponse> responseObserver) {
    SearchRequestHandler handler =
        new SearchRequestHandler(
            request,
            (ServerCallStreamObserver<DispatchSearch.SearchResponse>) responseObserver,
            fileStore,
            indexStore,
            batchSize,
            metrics);
    try {
      executorService.execute(handler);
    } catch (RejectedExecutionException e) {
      LOG.warn(
          "[trace_id {}] partition {} rejected, worker is shutting down",
          request.getTraceId(),
          request.getPartition());
      metrics.rejected.increment();
      handler.reject(Status.UNAVAILABLE.withDescription("worker is shutting down"));
    }
  }

  @Override
  public void close() {
    executorService.shutdownNow();
    try {
      if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
        LOG.warn("Search handlers did not stop within 5s");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
