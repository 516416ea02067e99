package com.yourorg.jobhistory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;

/**
 * Merges a runtime field map and a config field map into a {@link JobRecord}.
 * <p>
 * Config wins on key collisions. Decimal text becomes a number, time fields go from
 * milliseconds to seconds, then the latency/duration metrics and the time bucket are
 * derived. Arithmetic is exact.
 */
public class JobAssembler {

  public static final String TIME_MARKER = "TIME";

  public static final String SUBMIT_TIME = "SUBMIT_TIME";
  public static final String LAUNCH_TIME = "LAUNCH_TIME";
  public static final String FINISH_TIME = "FINISH_TIME";

  public static final String LAUNCH_LATENCY = "LAUNCH_LATENCY";
  public static final String TOTAL_DURATION = "TOTAL_DURATION";
  public static final String ACTUAL_DURATION = "ACTUAL_DURATION";
  public static final String TIME_BUCKET = "TIME_BUCKET";

  private final String bucketField;
  private final BigDecimal interval;

  public JobAssembler() {
    this(SUBMIT_TIME, 60);
  }

  public JobAssembler(String bucketField, long interval) {
    if (interval <= 0) throw new IllegalArgumentException("interval must be > 0");
    this.bucketField = bucketField;
    this.interval = BigDecimal.valueOf(interval);
  }

  public JobRecord assemble(Map<String, ?> runtimeFields, Map<String, String> configFields) {
    Map<String, Object> merged = new LinkedHashMap<>(runtimeFields);
    merged.putAll(configFields);

    for (Map.Entry<String, Object> e : merged.entrySet()) {
      Object v = toValue(e.getValue());
      if (v instanceof BigDecimal && isTimeField(e.getKey())) v = ((BigDecimal) v).movePointLeft(3);
      e.setValue(v);
    }

    BigDecimal submit = required(merged, SUBMIT_TIME);
    BigDecimal launch = required(merged, LAUNCH_TIME);
    BigDecimal finish = required(merged, FINISH_TIME);

    merged.put(LAUNCH_LATENCY, launch.subtract(submit));
    merged.put(TOTAL_DURATION, finish.subtract(submit));
    merged.put(ACTUAL_DURATION, finish.subtract(launch));

    merged.put(TIME_BUCKET, BigDecimal.valueOf(timeBucket(required(merged, bucketField))));
    return new JobRecord(merged);
  }

  /** {@code floor(value / interval) * interval}; never rounds up. */
  public long timeBucket(BigDecimal value) {
    return value.divide(interval, 0, RoundingMode.FLOOR).multiply(interval).longValue();
  }

  public static boolean isTimeField(String name) {
    return name.contains(TIME_MARKER);
  }

  public static Object toValue(Object raw) {
    if (!(raw instanceof String)) return raw;
    BigDecimal n = parseNumber((String) raw);
    return n != null ? n : raw;
  }

  static BigDecimal parseNumber(String s) {
    if (s == null || s.isBlank()) return null;
    try {
      return new BigDecimal(s.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static BigDecimal required(Map<String, Object> fields, String name) {
    Object v = fields.get(name);
    if (v == null) throw new RecordAssemblyException("Missing " + name + " in job " + fields.get(ConfigDocParser.JOBID));
    if (!(v instanceof BigDecimal))
      throw new RecordAssemblyException("Non-numeric " + name + "='" + v + "' in job " + fields.get(ConfigDocParser.JOBID));
    return (BigDecimal) v;
  }
}
