package com.slack.dispatch.worker;

import static com.slack.dispatch.testlib.DispatchTestUtil.ORG;
import static com.slack.dispatch.testlib.DispatchTestUtil.STREAM;
import static com.slack.dispatch.testlib.DispatchTestUtil.logsScanNode;
import static com.slack.dispatch.testlib.MetricsUtil.getCount;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import brave.Tracing;
import com.google.common.collect.ImmutableList;
import com.slack.dispatch.plan.ComparisonFilter;
import com.slack.dispatch.plan.ScanNode;
import com.slack.dispatch.plan.ScanPlanCodec;
import com.slack.dispatch.proto.config.DispatchConfigs;
import com.slack.dispatch.proto.service.DispatchSearch;
import com.slack.dispatch.proto.service.SearchDispatchServiceGrpc;
import com.slack.dispatch.storage.InMemoryFileStore;
import com.slack.dispatch.storage.InMemoryIndexStore;
import com.slack.dispatch.storage.JsonIndexStore;
import com.slack.dispatch.storage.TermIndex;
import com.slack.dispatch.testlib.GrpcCleanupExtension;
import io.grpc.ManagedChannel;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.junit.jupiter.api.io.TempDir;

public class WorkerSearchServiceTest {
  @RegisterExtension public final GrpcCleanupExtension grpcCleanup = new GrpcCleanupExtension();

  @TempDir Path dataDirectory;
  @TempDir Path indexDirectory;

  private SimpleMeterRegistry meterRegistry;
  private WorkerSearchService service;
  private SearchDispatchServiceGrpc.SearchDispatchServiceBlockingStub stub;

  @BeforeEach
  public void setUp() throws IOException {
    Tracing.newBuilder().build();
    meterRegistry = new SimpleMeterRegistry();

    Files.write(
        dataDirectory.resolve("10.jsonl"),
        List.of(
            "{\"_timestamp\": 1000, \"region\": \"a\", \"message\": \"disk full on host\"}",
            "{\"_timestamp\": 1500, \"region\": \"b\", \"message\": \"request served\"}",
            "",
            "{\"_timestamp\": 2500, \"region\": \"a\", \"message\": \"too late\"}"));
    Files.write(
        dataDirectory.resolve("11.jsonl"),
        List.of("{\"_timestamp\": 1999, \"region\": \"a\", \"latency\": 12}"));
    new JsonIndexStore(indexDirectory)
        .write(
            "11.idx",
            new TermIndex(Map.of("region", Set.of("a")), Set.of("12")));

    service =
        WorkerSearchService.fromConfig(
            DispatchConfigs.WorkerConfig.newBuilder()
                .setDataDirectory(dataDirectory.toString())
                .setIndexDirectory(indexDirectory.toString())
                .setBatchSize(10)
                .setHandlerThreads(2)
                .build(),
            meterRegistry);
    stub = SearchDispatchServiceGrpc.newBlockingStub(serve(service));
  }

  @AfterEach
  public void tearDown() {
    service.close();
    meterRegistry.close();
  }

  @Test
  public void testSearchFilesOnDisk() {
    List<DispatchSearch.SearchResponse> responses =
        ImmutableList.copyOf(stub.search(request(logsScanNode().build(), 10, 11)));

    assertThat(responses).hasSize(2);
    List<DispatchSearch.Row> rows = responses.get(0).getBatch().getRowsList();
    assertThat(rows)
        .extracting(DispatchSearch.Row::getTimestamp)
        .containsExactly(1000L, 1500L, 1999L);
    // _timestamp, region, level, message, latency
    assertThat(rows.get(0).getValues(1).getStringValue()).isEqualTo("a");
    assertThat(rows.get(0).getValues(2).getValueCase())
        .isEqualTo(DispatchSearch.Value.ValueCase.VALUE_NOT_SET);
    assertThat(rows.get(2).getValues(4).getLongValue()).isEqualTo(12);

    DispatchSearch.ScanStats stats = responses.get(1).getStats();
    assertThat(stats.getFiles()).isEqualTo(2);
    assertThat(stats.getRecords()).isEqualTo(4);
    assertThat(stats.getRows()).isEqualTo(3);
  }

  @Test
  public void testPlanFilterAndMatchAllKeys() {
    ScanNode scanNode =
        logsScanNode()
            .filter(new ComparisonFilter("region", ComparisonFilter.Operator.EQ, "a"))
            .build();
    DispatchSearch.SearchRequest request =
        request(scanNode, 10, 11).toBuilder().addMatchAllKeys("disk").build();

    List<DispatchSearch.SearchResponse> responses = ImmutableList.copyOf(stub.search(request));

    assertThat(responses.get(0).getBatch().getRowsList())
        .extracting(DispatchSearch.Row::getTimestamp)
        .containsExactly(1000L);
  }

  @Test
  public void testIndexOnDiskPrunesFile() {
    DispatchSearch.SearchRequest request =
        request(logsScanNode().build(), 10, 11).toBuilder()
            .setUseInvertedIndex(true)
            .addIdxFileList(
                DispatchSearch.IdxFileName.newBuilder().setFileId(11).setName("11.idx"))
            .addEqualKeys(DispatchSearch.KvItem.newBuilder().setKey("region").setValue("b"))
            .build();

    List<DispatchSearch.SearchResponse> responses = ImmutableList.copyOf(stub.search(request));

    assertThat(responses.get(0).getBatch().getRowsList())
        .extracting(DispatchSearch.Row::getTimestamp)
        .containsExactly(1500L);
    DispatchSearch.ScanStats stats = responses.get(1).getStats();
    assertThat(stats.getIdxFiles()).isEqualTo(1);
    assertThat(stats.getFilesPruned()).isEqualTo(1);
    assertThat(stats.getFiles()).isEqualTo(1);
  }

  @Test
  public void testMissingFileIsNotFound() {
    assertThatExceptionOfType(StatusRuntimeException.class)
        .isThrownBy(
            () -> ImmutableList.copyOf(stub.search(request(logsScanNode().build(), 10, 12))))
        .satisfies(e -> assertThat(e.getStatus().getCode()).isEqualTo(Status.Code.NOT_FOUND));
    assertThat(getCount(WorkerMetrics.WORKER_REQUESTS, "state", "failed", meterRegistry))
        .isEqualTo(1);
  }

  @Test
  public void testMalformedFileIsInternalError() throws IOException {
    Files.writeString(dataDirectory.resolve("13.jsonl"), "{\"region\": \"a\"");

    assertThatExceptionOfType(StatusRuntimeException.class)
        .isThrownBy(
            () -> ImmutableList.copyOf(stub.search(request(logsScanNode().build(), 13))))
        .satisfies(e -> assertThat(e.getStatus().getCode()).isEqualTo(Status.Code.INTERNAL));
  }

  @Test
  public void testRejectedAfterClose() {
    service.close();

    assertThatExceptionOfType(StatusRuntimeException.class)
        .isThrownBy(
            () -> ImmutableList.copyOf(stub.search(request(logsScanNode().build(), 10))))
        .satisfies(e -> assertThat(e.getStatus().getCode()).isEqualTo(Status.Code.UNAVAILABLE));
    assertThat(getCount(WorkerMetrics.WORKER_REQUESTS_REJECTED, meterRegistry)).isEqualTo(1);
  }

  @Test
  public void testBatchSizeMustBePositive() {
    assertThatIllegalArgumentException()
        .isThrownBy(
            () ->
                new WorkerSearchService(
                    new InMemoryFileStore(), new InMemoryIndexStore(), 0, 1, meterRegistry));
  }

  private ManagedChannel serve(WorkerSearchService worker) throws IOException {
    String serverName = InProcessServerBuilder.generateName();
    grpcCleanup.register(
        InProcessServerBuilder.forName(serverName)
            .directExecutor()
            .addService(worker)
            .build()
            .start());
    return grpcCleanup.register(
        InProcessChannelBuilder.forName(serverName).directExecutor().build());
  }

  private static DispatchSearch.SearchRequest request(ScanNode scanNode, long... fileIds) {
    DispatchSearch.SearchRequest.Builder builder =
        DispatchSearch.SearchRequest.newBuilder()
            .setTraceId("worker-test")
            .setOrgId(ORG)
            .setStreamType(STREAM)
            .setPlan(ScanPlanCodec.encodeToByteString(scanNode))
            .setStartTime(1000)
            .setEndTime(2000)
            .setTimeout(10);
    for (long fileId : fileIds) {
      builder.addFileIdList(fileId);
    }
    return builder.build();
  }
}
