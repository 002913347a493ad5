package com.slack.dispatch.plan;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;
import java.util.Objects;

/** Conjunction or disjunction of child expressions. */
public class BooleanFilter extends FilterExpression {

  public enum Kind {
    AND,
    OR
  }

  public final Kind kind;
  public final List<FilterExpression> children;

  public BooleanFilter(Kind kind, List<FilterExpression> children) {
    checkArgument(kind != null, "kind can't be null");
    checkArgument(children != null && !children.isEmpty(), "%s needs at least one child", kind);
    this.kind = kind;
    this.children = List.copyOf(children);
  }

  public static BooleanFilter and(FilterExpression... children) {
    return new BooleanFilter(Kind.AND, List.of(children));
  }

  public static BooleanFilter or(FilterExpression... children) {
    return new BooleanFilter(Kind.OR, List.of(children));
  }

  @Override
  public boolean evaluate(ColumnValues row) {
    if (kind == Kind.AND) {
      for (FilterExpression child : children) {
        if (!child.evaluate(row)) {
          return false;
        }
      }
      return true;
    }
    for (FilterExpression child : children) {
      if (child.evaluate(row)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof BooleanFilter that)) return false;
    return kind == that.kind && children.equals(that.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, children);
  }

  @Override
  public String toString() {
    return kind + children.toString();
  }
}
