package com.yourorg.jobhistory;

import java.math.BigDecimal;
import java.util.*;

/**
 * One assembled job. Values are {@link BigDecimal} or {@link String}; time fields are
 * in seconds. Immutable.
 */
public final class JobRecord {
  private final Map<String, Object> fields;

  public JobRecord(Map<String, Object> fields) {
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public Map<String, Object> fields() {
    return fields;
  }

  public Object get(String name) {
    return fields.get(name);
  }

  public boolean has(String name) {
    return fields.containsKey(name);
  }

  public BigDecimal number(String name) {
    Object v = fields.get(name);
    return v instanceof BigDecimal ? (BigDecimal) v : null;
  }

  public String jobId() {
    Object v = fields.get(ConfigDocParser.JOBID);
    return v != null ? v.toString() : null;
  }

  @Override
  public String toString() {
    return "JobRecord" + fields;
  }
}
