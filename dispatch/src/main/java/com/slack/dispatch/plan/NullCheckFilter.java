package com.slack.dispatch.plan;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;

/** IS NULL, or IS NOT NULL when negated. */
public class NullCheckFilter extends FilterExpression {
  public final String column;
  public final boolean negated;

  public NullCheckFilter(String column, boolean negated) {
    checkArgument(column != null && !column.isEmpty(), "column can't be null or empty");
    this.column = column;
    this.negated = negated;
  }

  @Override
  public boolean evaluate(ColumnValues row) {
    return (row.get(column) == null) != negated;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof NullCheckFilter that)) return false;
    return negated == that.negated && column.equals(that.column);
  }

  @Override
  public int hashCode() {
    return Objects.hash(column, negated);
  }

  @Override
  public String toString() {
    return column + (negated ? " IS NOT NULL" : " IS NULL");
  }
}
