package com.slack.dispatch.plan;

/** Read access to the column values of one row, used when evaluating filter expressions. */
public interface ColumnValues {

  /** Returns the value of the column, or null if the row has no value for it. */
  Object get(String column);
}
