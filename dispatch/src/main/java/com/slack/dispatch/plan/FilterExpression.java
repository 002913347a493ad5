package com.slack.dispatch.plan;

/**
 * A boolean predicate over the columns of a row. Filter expressions are immutable and compare by
 * value so that a decoded plan equals the plan that was encoded.
 */
public abstract class FilterExpression {

  public abstract boolean evaluate(ColumnValues row);

  /**
   * Compares two column values. Numbers compare numerically regardless of their boxed type, strings
   * lexicographically and booleans false before true.
   *
   * @return the comparison result, or null when the values are not comparable
   */
  static Integer compareValues(Object left, Object right) {
    if (left == null || right == null) {
      return null;
    }
    if (left instanceof Number l && right instanceof Number r) {
      if ((l instanceof Long || l instanceof Integer)
          && (r instanceof Long || r instanceof Integer)) {
        return Long.compare(l.longValue(), r.longValue());
      }
      return Double.compare(l.doubleValue(), r.doubleValue());
    }
    if (left instanceof String l && right instanceof String r) {
      return l.compareTo(r);
    }
    if (left instanceof Boolean l && right instanceof Boolean r) {
      return Boolean.compare(l, r);
    }
    return null;
  }

  static void checkLiteral(Object literal) {
    if (!(literal instanceof String
        || literal instanceof Long
        || literal instanceof Double
        || literal instanceof Boolean)) {
      throw new IllegalArgumentException(
          "Unsupported literal " + literal + ", expected a String, Long, Double or Boolean");
    }
  }
}
