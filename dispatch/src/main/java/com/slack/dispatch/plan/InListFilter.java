package com.slack.dispatch.plan;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;
import java.util.Objects;

/** Matches rows whose column equals one of the listed literals, or none of them when negated. */
public class InListFilter extends FilterExpression {
  public final String column;
  public final List<Object> values;
  public final boolean negated;

  public InListFilter(String column, List<Object> values, boolean negated) {
    checkArgument(column != null && !column.isEmpty(), "column can't be null or empty");
    checkArgument(values != null && !values.isEmpty(), "in list can't be empty");
    values.forEach(FilterExpression::checkLiteral);
    this.column = column;
    this.values = List.copyOf(values);
    this.negated = negated;
  }

  @Override
  public boolean evaluate(ColumnValues row) {
    Object value = row.get(column);
    if (value == null) {
      return false;
    }
    boolean found = false;
    for (Object candidate : values) {
      Integer cmp = compareValues(value, candidate);
      if (cmp != null && cmp == 0) {
        found = true;
        break;
      }
    }
    return found != negated;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof InListFilter that)) return false;
    return negated == that.negated && column.equals(that.column) && values.equals(that.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(column, values, negated);
  }

  @Override
  public String toString() {
    return column + (negated ? " NOT IN " : " IN ") + values;
  }
}
