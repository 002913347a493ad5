package com.slack.dispatch.plan;

/** Column types a scan node schema can declare. TIMESTAMP values are epoch microseconds. */
public enum FieldType {
  STRING,
  LONG,
  DOUBLE,
  BOOLEAN,
  TIMESTAMP
}
