package com.yourorg.jobhistory;

import java.util.*;

public final class GroupingSpec {
  private final List<String> fields;

  public GroupingSpec(List<String> fields) {
    if (fields == null || fields.isEmpty()) throw new IllegalArgumentException("empty grouping");
    this.fields = List.copyOf(fields);
  }

  public static GroupingSpec of(String... fields) {
    return new GroupingSpec(Arrays.asList(fields));
  }

  public List<String> fields() {
    return fields;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof GroupingSpec && ((GroupingSpec) o).fields.equals(fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return String.join(",", fields);
  }
}
