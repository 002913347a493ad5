package com.slack.dispatch.plan;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ScanNode is the executable form of a physical scan plan: the schema of the scanned stream, an
 * optional projection into that schema, optional filter expressions (all of which must hold), an
 * optional row limit and whether the underlying files are already ordered by time.
 *
 * <p>A scan node is immutable. Every partition of a query carries the same scan node, only the file
 * list it is bound to differs.
 */
public class ScanNode {
  public final String name;
  public final List<SchemaField> schema;
  private final List<Integer> projection;
  private final List<FilterExpression> filters;
  private final Long limit;
  public final boolean sortedByTime;

  public ScanNode(
      String name,
      List<SchemaField> schema,
      List<Integer> projection,
      List<FilterExpression> filters,
      Long limit,
      boolean sortedByTime) {
    checkArgument(name != null, "name can't be null");
    checkArgument(schema != null && !schema.isEmpty(), "schema can't be null or empty");
    Set<String> fieldNames = new HashSet<>();
    for (SchemaField field : schema) {
      checkArgument(fieldNames.add(field.name), "duplicate field %s in schema", field.name);
    }
    if (projection != null) {
      Set<Integer> seen = new HashSet<>();
      for (Integer index : projection) {
        checkArgument(
            index != null && index >= 0 && index < schema.size(),
            "projection index %s is outside of the schema",
            index);
        checkArgument(seen.add(index), "projection index %s is repeated", index);
      }
    }
    checkArgument(limit == null || limit >= 0, "limit can't be negative");

    this.name = name;
    this.schema = List.copyOf(schema);
    this.projection = projection == null ? null : List.copyOf(projection);
    this.filters = filters == null ? null : List.copyOf(filters);
    this.limit = limit;
    this.sortedByTime = sortedByTime;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public Optional<List<Integer>> getProjection() {
    return Optional.ofNullable(projection);
  }

  public Optional<List<FilterExpression>> getFilters() {
    return Optional.ofNullable(filters);
  }

  public Optional<Long> getLimit() {
    return Optional.ofNullable(limit);
  }

  /** The columns a worker returns for every row, in order. */
  public List<SchemaField> outputSchema() {
    if (projection == null) {
      return schema;
    }
    List<SchemaField> output = new ArrayList<>(projection.size());
    for (int index : projection) {
      output.add(schema.get(index));
    }
    return output;
  }

  /** Returns true if the row satisfies every filter expression of this node. */
  public boolean matches(ColumnValues row) {
    if (filters == null) {
      return true;
    }
    for (FilterExpression filter : filters) {
      if (!filter.evaluate(row)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ScanNode that)) return false;
    return sortedByTime == that.sortedByTime
        && name.equals(that.name)
        && schema.equals(that.schema)
        && Objects.equals(projection, that.projection)
        && Objects.equals(filters, that.filters)
        && Objects.equals(limit, that.limit);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, schema, projection, filters, limit, sortedByTime);
  }

  @Override
  public String toString() {
    return "ScanNode{"
        + "name='"
        + name
        + '\''
        + ", schema="
        + schema
        + ", projection="
        + projection
        + ", filters="
        + filters
        + ", limit="
        + limit
        + ", sortedByTime="
        + sortedByTime
        + '}';
  }

  public static class Builder {
    private final String name;
    private final List<SchemaField> schema = new ArrayList<>();
    private List<Integer> projection;
    private List<FilterExpression> filters;
    private Long limit;
    private boolean sortedByTime;

    private Builder(String name) {
      this.name = name;
    }

    public Builder field(String fieldName, FieldType type) {
      schema.add(SchemaField.of(fieldName, type));
      return this;
    }

    public Builder field(SchemaField field) {
      schema.add(field);
      return this;
    }

    public Builder projection(List<Integer> projection) {
      this.projection = projection;
      return this;
    }

    public Builder filter(FilterExpression filter) {
      if (filters == null) {
        filters = new ArrayList<>();
      }
      filters.add(filter);
      return this;
    }

    public Builder limit(long limit) {
      this.limit = limit;
      return this;
    }

    public Builder sortedByTime(boolean sortedByTime) {
      this.sortedByTime = sortedByTime;
      return this;
    }

    public ScanNode build() {
      return new ScanNode(name, schema, projection, filters, limit, sortedByTime);
    }
  }
}
