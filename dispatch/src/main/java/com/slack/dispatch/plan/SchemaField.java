package com.slack.dispatch.plan;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;

/** A single named, typed column of a scan node output schema. */
public class SchemaField {
  public final String name;
  public final FieldType type;
  public final boolean nullable;

  public SchemaField(String name, FieldType type, boolean nullable) {
    checkArgument(name != null && !name.isEmpty(), "field name can't be null or empty");
    checkArgument(type != null, "field type can't be null");
    this.name = name;
    this.type = type;
    this.nullable = nullable;
  }

  public static SchemaField of(String name, FieldType type) {
    return new SchemaField(name, type, true);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SchemaField that)) return false;
    return nullable == that.nullable && name.equals(that.name) && type == that.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, nullable);
  }

  @Override
  public String toString() {
    return "SchemaField{"
        + "name='"
        + name
        + '\''
        + ", type="
        + type
        + ", nullable="
        + nullable
        + '}';
  }
}
