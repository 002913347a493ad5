package com.slack.dispatch.plan;

import static com.google.common.base.Preconditions.checkArgument;

public class NotFilter extends FilterExpression {
  public final FilterExpression child;

  public NotFilter(FilterExpression child) {
    checkArgument(child != null, "child can't be null");
    this.child = child;
  }

  @Override
  public boolean evaluate(ColumnValues row) {
    return !child.evaluate(row);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof NotFilter that)) return false;
    return child.equals(that.child);
  }

  @Override
  public int hashCode() {
    return 31 * child.hashCode() + 7;
  }

  @Override
  public String toString() {
    return "NOT(" + child + ")";
  }
}
