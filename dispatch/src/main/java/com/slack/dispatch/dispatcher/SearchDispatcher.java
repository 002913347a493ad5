package com.slack.dispatch.dispatcher;

import brave.ScopedSpan;
import brave.Tracing;
import brave.grpc.GrpcTracing;
import com.slack.dispatch.cluster.DispatchTarget;
import com.slack.dispatch.cluster.TargetResolver;
import com.slack.dispatch.partition.LocalityException;
import com.slack.dispatch.proto.config.DispatchConfigs;
import com.slack.dispatch.proto.service.DispatchSearch;
import com.slack.dispatch.proto.service.SearchDispatchServiceGrpc;
import io.grpc.Status;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends the partitions of a query to the endpoints that own them, one server streaming call per
 * partition, and hands back a {@link QuerySession} to consume the results. The dispatcher never
 * retries a partition; a failed partition does not affect its siblings.
 */
public class SearchDispatcher {
  private static final Logger LOG = LoggerFactory.getLogger(SearchDispatcher.class);

  private final TargetResolver targetResolver;
  private final StubProvider stubProvider;
  private final DispatchConfigs.CompletionPolicy defaultPolicy;
  private final DispatchMetrics metrics;

  public SearchDispatcher(
      TargetResolver targetResolver, StubProvider stubProvider, MeterRegistry meterRegistry) {
    this(
        targetResolver,
        stubProvider,
        meterRegistry,
        DispatchConfigs.CompletionPolicy.REQUIRE_ALL_PARTITIONS);
  }

  public SearchDispatcher(
      TargetResolver targetResolver,
      StubProvider stubProvider,
      MeterRegistry meterRegistry,
      DispatchConfigs.CompletionPolicy defaultPolicy) {
    this.targetResolver = targetResolver;
    this.stubProvider = stubProvider;
    this.defaultPolicy = defaultPolicy;
    this.metrics = new DispatchMetrics(meterRegistry);
  }

  /**
   * Starts every partition of one query. All requests have to carry the same trace id and distinct
   * partition numbers.
   */
  public QuerySession dispatch(List<DispatchSearch.SearchRequest> requests) {
    String traceId = validate(requests);
    ScopedSpan span = Tracing.currentTracer().startScopedSpan("SearchDispatcher.dispatch");
    span.tag("traceId", traceId);
    span.tag("partitions", String.valueOf(requests.size()));
    try {
      QuerySession session = new QuerySession(traceId, defaultPolicy, metrics);
      List<QuerySession.PartitionCall> calls = new ArrayList<>(requests.size());
      Map<QuerySession.PartitionCall, LocalityException> unresolved = new LinkedHashMap<>();
      for (DispatchSearch.SearchRequest request : requests) {
        try {
          calls.add(session.addCall(request, targetResolver.resolve(request)));
        } catch (LocalityException e) {
          unresolved.put(session.addCall(request, null), e);
        }
      }
      session.seal();

      unresolved.forEach(
          (call, e) -> {
            LOG.warn(
                "[trace_id {}] partition {} has no target: {}",
                traceId,
                call.partition(),
                e.getMessage());
            call.fail(
                new PartitionResult.Failed(
                    call.partition(),
                    FailureReason.LOCALITY,
                    false,
                    Status.NOT_FOUND.withDescription(e.getMessage())));
          });

      for (QuerySession.PartitionCall call : calls) {
        LOG.debug(
            "[trace_id {}] sending partition {} with {} files to {}",
            traceId,
            call.partition(),
            call.request.getFileIdListCount(),
            call.target);
        metrics.sent.increment();
        call.start(stubFor(call.target, call.request));
      }
      LOG.info(
          "[trace_id {}] dispatched {} partitions, {} without a target",
          traceId,
          calls.size(),
          unresolved.size());
      return session;
    } catch (RuntimeException e) {
      span.error(e);
      throw e;
    } finally {
      span.finish();
    }
  }

  private SearchDispatchServiceGrpc.SearchDispatchServiceStub stubFor(
      DispatchTarget target, DispatchSearch.SearchRequest request) {
    return stubProvider
        .stubFor(target)
        .withDeadlineAfter(request.getTimeout(), TimeUnit.SECONDS)
        .withInterceptors(GrpcTracing.newBuilder(Tracing.current()).build().newClientInterceptor());
  }

  private static String validate(List<DispatchSearch.SearchRequest> requests) {
    if (requests.isEmpty()) {
      return "";
    }
    String traceId = requests.get(0).getTraceId();
    Set<Integer> partitions = new HashSet<>();
    for (DispatchSearch.SearchRequest request : requests) {
      if (!request.getTraceId().equals(traceId)) {
        throw new IllegalArgumentException(
            "All partitions of a query must share trace id "
                + traceId
                + ", got "
                + request.getTraceId());
      }
      if (!partitions.add(request.getPartition())) {
        throw new IllegalArgumentException(
            "Partition " + request.getPartition() + " of " + traceId + " is listed twice");
      }
    }
    return traceId;
  }
}
