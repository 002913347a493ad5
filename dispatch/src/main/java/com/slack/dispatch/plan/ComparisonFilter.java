package com.slack.dispatch.plan;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;

/** Compares a column against a literal. A row without a value for the column never matches. */
public class ComparisonFilter extends FilterExpression {

  public enum Operator {
    EQ,
    NOT_EQ,
    LT,
    LT_EQ,
    GT,
    GT_EQ
  }

  public final String column;
  public final Operator op;
  public final Object literal;

  public ComparisonFilter(String column, Operator op, Object literal) {
    checkArgument(column != null && !column.isEmpty(), "column can't be null or empty");
    checkArgument(op != null, "operator can't be null");
    checkLiteral(literal);
    this.column = column;
    this.op = op;
    this.literal = literal;
  }

  @Override
  public boolean evaluate(ColumnValues row) {
    Integer cmp = compareValues(row.get(column), literal);
    if (cmp == null) {
      return false;
    }
    return switch (op) {
      case EQ -> cmp == 0;
      case NOT_EQ -> cmp != 0;
      case LT -> cmp < 0;
      case LT_EQ -> cmp <= 0;
      case GT -> cmp > 0;
      case GT_EQ -> cmp >= 0;
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ComparisonFilter that)) return false;
    return column.equals(that.column) && op == that.op && literal.equals(that.literal);
  }

  @Override
  public int hashCode() {
    return Objects.hash(column, op, literal);
  }

  @Override
  public String toString() {
    return column + " " + op + " " + literal;
  }
}
