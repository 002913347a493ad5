package com.slack.dispatch.dispatcher;

import static com.slack.dispatch.testlib.DispatchTestUtil.ORG;
import static com.slack.dispatch.testlib.DispatchTestUtil.STREAM;
import static com.slack.dispatch.testlib.DispatchTestUtil.batchRows;
import static com.slack.dispatch.testlib.DispatchTestUtil.logsScanNode;
import static com.slack.dispatch.testlib.DispatchTestUtil.rows;
import static org.assertj.core.api.Assertions.assertThat;

import brave.Tracing;
import com.slack.dispatch.cluster.DispatchTarget;
import com.slack.dispatch.partition.FileKey;
import com.slack.dispatch.proto.config.DispatchConfigs;
import com.slack.dispatch.request.QueryParams;
import com.slack.dispatch.storage.InMemoryFileStore;
import com.slack.dispatch.storage.InMemoryIndexStore;
import com.slack.dispatch.testlib.GrpcCleanupExtension;
import com.slack.dispatch.testlib.InProcessStubProvider;
import com.slack.dispatch.worker.WorkerSearchService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

public class SearchCoordinatorTest {
  private static final String WORKER_0 = "gproto+http://worker-0:8080";
  private static final String WORKER_1 = "gproto+http://worker-1:8080";

  @RegisterExtension public final GrpcCleanupExtension grpcCleanup = new GrpcCleanupExtension();

  private SimpleMeterRegistry meterRegistry;
  private InProcessStubProvider stubProvider;
  private WorkerSearchService worker0;
  private WorkerSearchService worker1;

  @BeforeEach
  public void setUp() throws IOException {
    Tracing.newBuilder().build();
    meterRegistry = new SimpleMeterRegistry();
    stubProvider = new InProcessStubProvider(grpcCleanup);
    // hash placement: even ids on worker 0, odd ids on worker 1
    worker0 =
        new WorkerSearchService(
            new InMemoryFileStore().put(2, rows(1000, 3)).put(4, rows(1100, 3)),
            new InMemoryIndexStore(),
            10,
            1,
            meterRegistry);
    worker1 =
        new WorkerSearchService(
            new InMemoryFileStore().put(3, rows(1200, 3)),
            new InMemoryIndexStore(),
            10,
            1,
            meterRegistry);
    stubProvider.serve(DispatchTarget.worker(WORKER_0), worker0);
    stubProvider.serve(DispatchTarget.worker(WORKER_1), worker1);
  }

  @AfterEach
  public void tearDown() {
    worker0.close();
    worker1.close();
    meterRegistry.close();
  }

  @Test
  public void testCoordinatorFromConfig() throws Exception {
    DispatchConfigs.DispatchConfig config =
        config(DispatchConfigs.QueryConfig.newBuilder().setMaxFilesPerPartition(1));
    SearchCoordinator coordinator =
        SearchCoordinator.fromConfig(config, stubProvider, meterRegistry);

    // no timeout set, the configured default applies
    QuerySession session =
        coordinator.search(
            logsScanNode().build(),
            List.of(
                FileKey.of(2, ORG, STREAM), FileKey.of(3, ORG, STREAM), FileKey.of(4, ORG, STREAM)),
            QueryParams.builder("c1", ORG, STREAM).timeRange(1000, 2000).build());
    List<PartitionResult> results = session.drain(Duration.ofSeconds(10));

    assertThat(batchRows(results)).hasSize(9);
    // one file per partition
    assertThat(session.statuses()).hasSize(3);
    assertThat(session.outcome().successful()).isTrue();
  }

  @Test
  public void testPolicyFromConfig() throws Exception {
    DispatchConfigs.DispatchConfig config =
        config(
            DispatchConfigs.QueryConfig.newBuilder()
                .setCompletionPolicy(DispatchConfigs.CompletionPolicy.ALLOW_PARTIAL_RESULTS));
    SearchCoordinator coordinator =
        SearchCoordinator.fromConfig(config, stubProvider, meterRegistry);

    // file 5 hashes to worker 1, which does not hold it
    QuerySession session =
        coordinator.search(
            logsScanNode().build(),
            List.of(FileKey.of(2, ORG, STREAM), FileKey.of(5, ORG, STREAM)),
            QueryParams.builder("c2", ORG, STREAM).timeRange(1000, 2000).timeoutSecs(5).build());
    session.drain(Duration.ofSeconds(10));

    QueryOutcome outcome = session.outcome();
    assertThat(outcome.policy).isEqualTo(DispatchConfigs.CompletionPolicy.ALLOW_PARTIAL_RESULTS);
    assertThat(outcome.failures).containsOnlyKeys(1);
    assertThat(outcome.successful()).isTrue();
  }

  private static DispatchConfigs.DispatchConfig config(
      DispatchConfigs.QueryConfig.Builder queryConfig) {
    return DispatchConfigs.DispatchConfig.newBuilder()
        .setTopologyConfig(
            DispatchConfigs.TopologyConfig.newBuilder()
                .addWorkerUrls(WORKER_0)
                .addWorkerUrls(WORKER_1))
        .setQueryConfig(queryConfig.setDefaultTimeoutSecs(10))
        .build();
  }
}
