package com.slack.dispatch.dispatcher;

import brave.ScopedSpan;
import brave.Tracing;
import com.slack.dispatch.cluster.TargetResolver;
import com.slack.dispatch.partition.FileKey;
import com.slack.dispatch.partition.LocalityException;
import com.slack.dispatch.partition.PartitionAssigner;
import com.slack.dispatch.partition.PartitionAssignment;
import com.slack.dispatch.plan.ScanNode;
import com.slack.dispatch.plan.ScanPlanCodec;
import com.slack.dispatch.proto.config.DispatchConfigs;
import com.slack.dispatch.proto.service.DispatchSearch;
import com.slack.dispatch.request.QueryParams;
import com.slack.dispatch.request.SearchRequestBuilder;
import com.slack.dispatch.request.ValidationException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the querying side: partitions a query's files, builds one request per partition
 * and dispatches them. A super cluster query is sent whole to the regional gateway, which
 * partitions it across its own cluster.
 */
public class SearchCoordinator {
  private static final Logger LOG = LoggerFactory.getLogger(SearchCoordinator.class);

  private final PartitionAssigner partitionAssigner;
  private final SearchDispatcher dispatcher;
  private final long defaultTimeoutSecs;

  public SearchCoordinator(PartitionAssigner partitionAssigner, SearchDispatcher dispatcher) {
    this(partitionAssigner, dispatcher, 0);
  }

  /**
   * @param defaultTimeoutSecs timeout of queries that don't set one, 0 to reject such queries
   */
  public SearchCoordinator(
      PartitionAssigner partitionAssigner, SearchDispatcher dispatcher, long defaultTimeoutSecs) {
    this.partitionAssigner = partitionAssigner;
    this.dispatcher = dispatcher;
    this.defaultTimeoutSecs = defaultTimeoutSecs;
  }

  public static SearchCoordinator fromConfig(
      DispatchConfigs.DispatchConfig config, StubProvider stubProvider, MeterRegistry registry) {
    TargetResolver targetResolver =
        TargetResolver.fromConfig(config.getTopologyConfig(), config.getSuperClusterConfig());
    DispatchConfigs.QueryConfig queryConfig = config.getQueryConfig();
    return new SearchCoordinator(
        new PartitionAssigner(
            targetResolver.getTopology(),
            queryConfig.getMaxFilesPerPartition(),
            queryConfig.getTargetPartitionsPerWorker()),
        new SearchDispatcher(
            targetResolver, stubProvider, registry, queryConfig.getCompletionPolicy()),
        queryConfig.getDefaultTimeoutSecs());
  }

  public QuerySession search(ScanNode scanNode, Collection<FileKey> files, QueryParams params)
      throws LocalityException, ValidationException {
    if (params.timeoutSecs == 0 && defaultTimeoutSecs > 0) {
      params = params.toBuilder().timeoutSecs(defaultTimeoutSecs).build();
    }
    ScopedSpan span = Tracing.currentTracer().startScopedSpan("SearchCoordinator.search");
    span.tag("traceId", String.valueOf(params.traceId));
    try {
      List<DispatchSearch.SearchRequest> requests =
          params.isSuperCluster
              ? superClusterRequest(scanNode, files, params)
              : partitioned(scanNode, files, params);
      LOG.info(
          "[trace_id {}] searching {} files of {}/{} in {} partitions",
          params.traceId,
          files.size(),
          params.orgId,
          params.streamType,
          requests.size());
      return dispatcher.dispatch(requests);
    } catch (Exception e) {
      span.error(e);
      throw e;
    } finally {
      span.finish();
    }
  }

  private List<DispatchSearch.SearchRequest> partitioned(
      ScanNode scanNode, Collection<FileKey> files, QueryParams params)
      throws LocalityException, ValidationException {
    PartitionAssignment assignment =
        partitionAssigner.assign(params.orgId, params.streamType, files, params.useInvertedIndex);
    return SearchRequestBuilder.buildAll(scanNode, assignment, params);
  }

  private static List<DispatchSearch.SearchRequest> superClusterRequest(
      ScanNode scanNode, Collection<FileKey> files, QueryParams params)
      throws ValidationException {
    Map<Long, FileKey> byId = new TreeMap<>();
    for (FileKey file : files) {
      byId.putIfAbsent(file.id, file);
    }
    List<DispatchSearch.IdxFileName> idxFiles = new ArrayList<>();
    if (params.useInvertedIndex) {
      byId.values()
          .forEach(
              file ->
                  file.getIndexFileName()
                      .ifPresent(
                          name ->
                              idxFiles.add(
                                  DispatchSearch.IdxFileName.newBuilder()
                                      .setFileId(file.id)
                                      .setName(name)
                                      .build())));
    }
    return List.of(
        SearchRequestBuilder.build(
            ScanPlanCodec.encodeToByteString(scanNode),
            0,
            new ArrayList<>(byId.keySet()),
            idxFiles,
            params));
  }
}
