package com.slack.dispatch.plan;

import static com.slack.dispatch.testlib.DispatchTestUtil.logsScanNode;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.google.protobuf.ByteString;
import com.slack.dispatch.proto.plan.PlanProtos;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ScanPlanCodecTest {

  @Test
  public void testRoundTripOfFullScanNode() throws PlanDecodeException {
    ScanNode scanNode =
        logsScanNode()
            .field(new SchemaField("ratio", FieldType.DOUBLE, true))
            .field("sampled", FieldType.BOOLEAN)
            .projection(List.of(0, 3, 4))
            .filter(new ComparisonFilter("latency", ComparisonFilter.Operator.GT_EQ, 10L))
            .filter(
                BooleanFilter.or(
                    new InListFilter("region", List.of("a", "b"), false),
                    new NotFilter(new NullCheckFilter("ratio", false))))
            .filter(
                BooleanFilter.and(
                    new ComparisonFilter("ratio", ComparisonFilter.Operator.LT, 0.5),
                    new ComparisonFilter("sampled", ComparisonFilter.Operator.EQ, true)))
            .limit(100)
            .sortedByTime(false)
            .build();

    DecodedPlan decoded = ScanPlanCodec.decode(ScanPlanCodec.encode(scanNode));

    assertThat(decoded.isKnown()).isTrue();
    assertThat(decoded.version()).isEqualTo(ScanPlanCodec.CURRENT_VERSION);
    assertThat(decoded.scanNode()).isEqualTo(scanNode);
  }

  @Test
  public void testRoundTripKeepsAbsentOptionalsAbsent() throws PlanDecodeException {
    ScanNode scanNode = logsScanNode().build();

    ScanNode decoded = ScanPlanCodec.decode(ScanPlanCodec.encodeToByteString(scanNode)).scanNode();

    assertThat(decoded).isEqualTo(scanNode);
    assertThat(decoded.getProjection()).isEmpty();
    assertThat(decoded.getFilters()).isEmpty();
    assertThat(decoded.getLimit()).isEmpty();
    assertThat(decoded.outputSchema()).isEqualTo(scanNode.schema);
  }

  @Test
  public void testZeroLimitAndEmptyProjectionSurvive() throws PlanDecodeException {
    ScanNode scanNode = logsScanNode().projection(List.of()).limit(0).build();

    ScanNode decoded = ScanPlanCodec.decode(ScanPlanCodec.encode(scanNode)).scanNode();

    assertThat(decoded.getLimit()).contains(0L);
    assertThat(decoded.getProjection()).contains(List.of());
    assertThat(decoded.outputSchema()).isEmpty();
  }

  @Test
  public void testEncodingIsDeterministic() {
    ScanNode scanNode =
        logsScanNode()
            .filter(new ComparisonFilter("region", ComparisonFilter.Operator.EQ, "a"))
            .build();

    assertThat(ScanPlanCodec.encode(scanNode)).isEqualTo(ScanPlanCodec.encode(scanNode));
  }

  @Test
  public void testEmptyOrCorruptPlansAreRejected() {
    assertThatExceptionOfType(PlanDecodeException.class)
        .isThrownBy(() -> ScanPlanCodec.decode(new byte[0]));
    assertThatExceptionOfType(PlanDecodeException.class)
        .isThrownBy(() -> ScanPlanCodec.decode(ByteString.EMPTY));
    assertThatExceptionOfType(PlanDecodeException.class)
        .isThrownBy(() -> ScanPlanCodec.decode(new byte[] {(byte) 0xff, (byte) 0xff, 0x01}));
  }

  @Test
  public void testUnknownVersionIsReportedNotDecoded() throws PlanDecodeException {
    byte[] plan =
        PlanProtos.PlanEnvelope.newBuilder()
            .setVersion(7)
            .setPayload(ByteString.copyFromUtf8("from the future"))
            .build()
            .toByteArray();

    DecodedPlan decoded = ScanPlanCodec.decode(plan);

    assertThat(decoded.isKnown()).isFalse();
    assertThat(decoded.version()).isEqualTo(7);
    assertThatExceptionOfType(PlanDecodeException.class).isThrownBy(decoded::scanNode);
  }

  @Test
  public void testMissingVersionIsRejected() {
    byte[] plan =
        PlanProtos.PlanEnvelope.newBuilder()
            .setPayload(
                ScanPlanCodec.toScanNodeProto(logsScanNode().build()).toByteString())
            .build()
            .toByteArray();

    assertThatExceptionOfType(PlanDecodeException.class)
        .isThrownBy(() -> ScanPlanCodec.decode(plan));
  }

  @Test
  public void testPayloadWithoutSchemaIsRejected() {
    byte[] plan = envelope(PlanProtos.ScanNodeV1.newBuilder().setName("logs").build());

    assertThatExceptionOfType(PlanDecodeException.class)
        .isThrownBy(() -> ScanPlanCodec.decode(plan))
        .withMessageContaining("no schema");
  }

  @Test
  public void testInvalidNodeIsRejected() {
    PlanProtos.ScanNodeV1 outOfRangeProjection =
        ScanPlanCodec.toScanNodeProto(logsScanNode().build()).toBuilder()
            .setProjection(PlanProtos.Projection.newBuilder().addIndices(42))
            .build();

    assertThatExceptionOfType(PlanDecodeException.class)
        .isThrownBy(() -> ScanPlanCodec.decode(envelope(outOfRangeProjection)));

    PlanProtos.ScanNodeV1 unnamedField =
        PlanProtos.ScanNodeV1.newBuilder()
            .setName("scan")
            .setSchema(
                PlanProtos.Schema.newBuilder()
                    .addFields(
                        PlanProtos.Field.newBuilder()
                            .setName("")
                            .setType(PlanProtos.FieldType.STRING)))
            .build();
    assertThatExceptionOfType(PlanDecodeException.class)
        .isThrownBy(() -> ScanPlanCodec.decode(envelope(unnamedField)))
        .withMessageContaining("is invalid");
  }

  @Test
  public void testUnknownFilterKindIsRejected() {
    PlanProtos.ScanNodeV1 node =
        ScanPlanCodec.toScanNodeProto(logsScanNode().build()).toBuilder()
            .setFilters(
                PlanProtos.FilterList.newBuilder().addExprs(PlanProtos.FilterExpr.newBuilder()))
            .build();

    assertThatExceptionOfType(PlanDecodeException.class)
        .isThrownBy(() -> ScanPlanCodec.decode(envelope(node)))
        .withMessageContaining("Unknown filter expression");
  }

  @Test
  public void testLiteralWithoutValueIsRejected() {
    PlanProtos.FilterExpr expr =
        PlanProtos.FilterExpr.newBuilder()
            .setComparison(
                PlanProtos.ComparisonExpr.newBuilder()
                    .setColumn("region")
                    .setOp(PlanProtos.ComparisonOperator.EQ))
            .build();

    assertThatExceptionOfType(PlanDecodeException.class)
        .isThrownBy(() -> ScanPlanCodec.fromFilterProto(expr));
  }

  private static byte[] envelope(PlanProtos.ScanNodeV1 node) {
    return PlanProtos.PlanEnvelope.newBuilder()
        .setVersion(ScanPlanCodec.CURRENT_VERSION)
        .setPayload(node.toByteString())
        .build()
        .toByteArray();
  }
}
