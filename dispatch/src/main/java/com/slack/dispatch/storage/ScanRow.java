package com.slack.dispatch.storage;

import static com.google.common.base.Preconditions.checkArgument;

import com.slack.dispatch.plan.ColumnValues;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/** A single row read from a data file: its timestamp in epoch microseconds plus named values. */
public class ScanRow implements ColumnValues {
  public static final String TIMESTAMP_COLUMN = "_timestamp";

  public final long timestamp;
  public final Map<String, Object> fields;

  public ScanRow(long timestamp, Map<String, Object> fields) {
    checkArgument(fields != null, "fields can't be null");
    this.timestamp = timestamp;
    this.fields = Collections.unmodifiableMap(new HashMap<>(fields));
  }

  /**
   * Builds a row from a decoded JSON object. The timestamp is read from {@link #TIMESTAMP_COLUMN}
   * and integral numbers are widened to long so they compare with plan literals.
   */
  public static ScanRow fromMap(Map<String, Object> source) {
    Object ts = source.get(TIMESTAMP_COLUMN);
    checkArgument(ts instanceof Number, "row is missing a numeric %s", TIMESTAMP_COLUMN);
    Map<String, Object> fields = new HashMap<>(source.size());
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      if (entry.getKey().equals(TIMESTAMP_COLUMN) || entry.getValue() == null) {
        continue;
      }
      Object value = entry.getValue();
      if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
        value = ((Number) value).longValue();
      } else if (value instanceof Float f) {
        value = f.doubleValue();
      }
      fields.put(entry.getKey(), value);
    }
    return new ScanRow(((Number) ts).longValue(), fields);
  }

  @Override
  public Object get(String column) {
    if (TIMESTAMP_COLUMN.equals(column)) {
      return timestamp;
    }
    return fields.get(column);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ScanRow that)) return false;
    return timestamp == that.timestamp && fields.equals(that.fields);
  }

  @Override
  public int hashCode() {
    return Objects.hash(timestamp, fields);
  }

  @Override
  public String toString() {
    return "ScanRow{" + "timestamp=" + timestamp + ", fields=" + fields + '}';
  }
}
