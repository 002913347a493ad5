package com.slack.dispatch.plan;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.slack.dispatch.proto.plan.PlanProtos;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts scan nodes to and from the compact binary plan carried by every search request. The
 * bytes are a {@link PlanProtos.PlanEnvelope} whose payload layout is chosen by its version, and
 * the payload carries the full schema so a worker can run a plan it has never seen before.
 */
public class ScanPlanCodec {

  public static final int CURRENT_VERSION = 1;

  public static byte[] encode(ScanNode scanNode) {
    return toEnvelope(scanNode).toByteArray();
  }

  public static ByteString encodeToByteString(ScanNode scanNode) {
    return toEnvelope(scanNode).toByteString();
  }

  public static DecodedPlan decode(ByteString plan) throws PlanDecodeException {
    if (plan == null) {
      throw new PlanDecodeException("Plan is missing");
    }
    return decode(plan.toByteArray());
  }

  public static DecodedPlan decode(byte[] plan) throws PlanDecodeException {
    if (plan == null || plan.length == 0) {
      throw new PlanDecodeException("Plan is empty");
    }

    PlanProtos.PlanEnvelope envelope;
    try {
      envelope = PlanProtos.PlanEnvelope.parseFrom(plan);
    } catch (InvalidProtocolBufferException e) {
      throw new PlanDecodeException("Plan envelope is corrupt", e);
    }
    if (envelope.getVersion() == 0) {
      throw new PlanDecodeException("Plan envelope has no version");
    }
    if (envelope.getVersion() != CURRENT_VERSION) {
      return new DecodedPlan.UnknownVersion(envelope.getVersion());
    }

    PlanProtos.ScanNodeV1 node;
    try {
      node = PlanProtos.ScanNodeV1.parseFrom(envelope.getPayload());
    } catch (InvalidProtocolBufferException e) {
      throw new PlanDecodeException("Scan node payload is corrupt", e);
    }
    try {
      return new DecodedPlan.Known(envelope.getVersion(), fromScanNodeProto(node));
    } catch (IllegalArgumentException e) {
      // field and filter constructors reject blank names and bad operands
      throw new PlanDecodeException("Scan node " + node.getName() + " is invalid", e);
    }
  }

  private static PlanProtos.PlanEnvelope toEnvelope(ScanNode scanNode) {
    return PlanProtos.PlanEnvelope.newBuilder()
        .setVersion(CURRENT_VERSION)
        .setPayload(toScanNodeProto(scanNode).toByteString())
        .build();
  }

  static PlanProtos.ScanNodeV1 toScanNodeProto(ScanNode scanNode) {
    PlanProtos.ScanNodeV1.Builder builder =
        PlanProtos.ScanNodeV1.newBuilder()
            .setName(scanNode.name)
            .setSortedByTime(scanNode.sortedByTime);

    PlanProtos.Schema.Builder schemaBuilder = PlanProtos.Schema.newBuilder();
    for (SchemaField field : scanNode.schema) {
      schemaBuilder.addFields(
          PlanProtos.Field.newBuilder()
              .setName(field.name)
              .setType(PlanProtos.FieldType.valueOf(field.type.name()))
              .setNullable(field.nullable));
    }
    builder.setSchema(schemaBuilder);

    scanNode
        .getProjection()
        .ifPresent(
            projection -> {
              PlanProtos.Projection.Builder projectionBuilder = PlanProtos.Projection.newBuilder();
              projection.forEach(index -> projectionBuilder.addIndices(index));
              builder.setProjection(projectionBuilder);
            });
    scanNode.getFilters().ifPresent(filters -> builder.setFilters(toFilterListProto(filters)));
    scanNode.getLimit().ifPresent(builder::setLimit);
    return builder.build();
  }

  static ScanNode fromScanNodeProto(PlanProtos.ScanNodeV1 node) throws PlanDecodeException {
    if (!node.hasSchema() || node.getSchema().getFieldsCount() == 0) {
      throw new PlanDecodeException("Scan node " + node.getName() + " has no schema");
    }

    List<SchemaField> schema = new ArrayList<>(node.getSchema().getFieldsCount());
    for (PlanProtos.Field field : node.getSchema().getFieldsList()) {
      if (field.getType() == PlanProtos.FieldType.UNRECOGNIZED) {
        throw new PlanDecodeException("Field " + field.getName() + " has an unknown type");
      }
      schema.add(
          new SchemaField(
              field.getName(), FieldType.valueOf(field.getType().name()), field.getNullable()));
    }

    List<Integer> projection = null;
    if (node.hasProjection()) {
      projection = new ArrayList<>(node.getProjection().getIndicesCount());
      for (long index : node.getProjection().getIndicesList()) {
        if (index < 0 || index > Integer.MAX_VALUE) {
          throw new PlanDecodeException("Projection index " + index + " is out of range");
        }
        projection.add((int) index);
      }
    }

    List<FilterExpression> filters = null;
    if (node.hasFilters()) {
      filters = fromFilterListProto(node.getFilters());
    }

    return new ScanNode(
        node.getName(),
        schema,
        projection,
        filters,
        node.hasLimit() ? node.getLimit() : null,
        node.getSortedByTime());
  }

  private static PlanProtos.FilterList toFilterListProto(List<FilterExpression> filters) {
    PlanProtos.FilterList.Builder builder = PlanProtos.FilterList.newBuilder();
    filters.forEach(filter -> builder.addExprs(toFilterProto(filter)));
    return builder.build();
  }

  static PlanProtos.FilterExpr toFilterProto(FilterExpression filter) {
    PlanProtos.FilterExpr.Builder builder = PlanProtos.FilterExpr.newBuilder();
    if (filter instanceof ComparisonFilter comparison) {
      builder.setComparison(
          PlanProtos.ComparisonExpr.newBuilder()
              .setColumn(comparison.column)
              .setOp(PlanProtos.ComparisonOperator.valueOf(comparison.op.name()))
              .setLiteral(toLiteralProto(comparison.literal)));
    } else if (filter instanceof NullCheckFilter nullCheck) {
      builder.setNullCheck(
          PlanProtos.NullCheckExpr.newBuilder()
              .setColumn(nullCheck.column)
              .setNegated(nullCheck.negated));
    } else if (filter instanceof InListFilter inList) {
      PlanProtos.InListExpr.Builder inListBuilder =
          PlanProtos.InListExpr.newBuilder()
              .setColumn(inList.column)
              .setNegated(inList.negated);
      inList.values.forEach(value -> inListBuilder.addValues(toLiteralProto(value)));
      builder.setInList(inListBuilder);
    } else if (filter instanceof BooleanFilter bool) {
      if (bool.kind == BooleanFilter.Kind.AND) {
        builder.setAndExprs(toFilterListProto(bool.children));
      } else {
        builder.setOrExprs(toFilterListProto(bool.children));
      }
    } else if (filter instanceof NotFilter not) {
      builder.setNotExpr(toFilterProto(not.child));
    } else {
      throw new IllegalArgumentException("Unsupported filter expression " + filter);
    }
    return builder.build();
  }

  private static List<FilterExpression> fromFilterListProto(PlanProtos.FilterList filterList)
      throws PlanDecodeException {
    List<FilterExpression> filters = new ArrayList<>(filterList.getExprsCount());
    for (PlanProtos.FilterExpr expr : filterList.getExprsList()) {
      filters.add(fromFilterProto(expr));
    }
    return filters;
  }

  static FilterExpression fromFilterProto(PlanProtos.FilterExpr expr) throws PlanDecodeException {
    try {
      switch (expr.getExprCase()) {
        case COMPARISON:
          PlanProtos.ComparisonExpr comparison = expr.getComparison();
          if (comparison.getOp() == PlanProtos.ComparisonOperator.UNRECOGNIZED) {
            throw new PlanDecodeException(
                "Unknown comparison operator on " + comparison.getColumn());
          }
          return new ComparisonFilter(
              comparison.getColumn(),
              ComparisonFilter.Operator.valueOf(comparison.getOp().name()),
              fromLiteralProto(comparison.getLiteral()));
        case NULL_CHECK:
          return new NullCheckFilter(
              expr.getNullCheck().getColumn(), expr.getNullCheck().getNegated());
        case IN_LIST:
          List<Object> values = new ArrayList<>(expr.getInList().getValuesCount());
          for (PlanProtos.Literal literal : expr.getInList().getValuesList()) {
            values.add(fromLiteralProto(literal));
          }
          return new InListFilter(
              expr.getInList().getColumn(), values, expr.getInList().getNegated());
        case AND_EXPRS:
          return new BooleanFilter(
              BooleanFilter.Kind.AND, fromFilterListProto(expr.getAndExprs()));
        case OR_EXPRS:
          return new BooleanFilter(BooleanFilter.Kind.OR, fromFilterListProto(expr.getOrExprs()));
        case NOT_EXPR:
          return new NotFilter(fromFilterProto(expr.getNotExpr()));
        default:
          // a filter kind added after this node was built, running without it would widen results
          throw new PlanDecodeException("Unknown filter expression kind " + expr.getExprCase());
      }
    } catch (IllegalArgumentException e) {
      throw new PlanDecodeException("Invalid filter expression", e);
    }
  }

  private static PlanProtos.Literal toLiteralProto(Object value) {
    PlanProtos.Literal.Builder builder = PlanProtos.Literal.newBuilder();
    if (value instanceof String s) {
      builder.setStringValue(s);
    } else if (value instanceof Long l) {
      builder.setLongValue(l);
    } else if (value instanceof Double d) {
      builder.setDoubleValue(d);
    } else if (value instanceof Boolean b) {
      builder.setBoolValue(b);
    } else {
      throw new IllegalArgumentException("Unsupported literal " + value);
    }
    return builder.build();
  }

  private static Object fromLiteralProto(PlanProtos.Literal literal) throws PlanDecodeException {
    return switch (literal.getValueCase()) {
      case STRING_VALUE -> literal.getStringValue();
      case LONG_VALUE -> literal.getLongValue();
      case DOUBLE_VALUE -> literal.getDoubleValue();
      case BOOL_VALUE -> literal.getBoolValue();
      default -> throw new PlanDecodeException("Literal has no value");
    };
  }
}
