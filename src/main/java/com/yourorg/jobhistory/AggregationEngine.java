package com.yourorg.jobhistory;

import java.math.BigDecimal;
import java.util.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sums job metrics per (time bucket, grouping key) for each grouping.
 * <p>
 * Only numeric, non-time fields are summed. Addition is exact, so the sums do not depend
 * on the order records are added in.
 */
public class AggregationEngine {
  private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

  public static final String UNKNOWN_VALUE = "value-unknown";

  private final List<GroupingSpec> groupings;
  private final MiningMode mode;

  private final Map<GroupingSpec, Map<BucketKey, Map<String, BigDecimal>>> buckets = new LinkedHashMap<>();
  private int projectionErrors;

  public AggregationEngine(List<GroupingSpec> groupings, MiningMode mode) {
    this.groupings = List.copyOf(groupings);
    this.mode = mode;
    for (GroupingSpec g : this.groupings) buckets.put(g, new HashMap<>());
  }

  public List<GroupingSpec> groupings() {
    return groupings;
  }

  public int projectionErrors() {
    return projectionErrors;
  }

  public void addAll(Iterable<JobRecord> records) {
    for (JobRecord r : records) add(r);
  }

  public void add(JobRecord record) {
    Map<String, BigDecimal> metrics = cleanMetrics(record);
    for (GroupingSpec g : groupings) {
      BigDecimal bucket = record.number(JobAssembler.TIME_BUCKET);
      if (bucket == null) {
        String msg = "Job " + record.jobId() + " has no numeric " + JobAssembler.TIME_BUCKET + " for grouping " + g;
        if (mode.isStrict()) throw new ProjectionKeyException(msg);
        projectionErrors++;
        log.warn("{}, skipping", msg);
        continue;
      }

      BucketKey key = new BucketKey(bucket.longValue(), keyValues(record, g));
      Map<String, BigDecimal> sums = buckets.get(g).computeIfAbsent(key, k -> new HashMap<>());
      metrics.forEach((name, v) -> sums.merge(name, v, BigDecimal::add));
    }
  }

  static Map<String, BigDecimal> cleanMetrics(JobRecord record) {
    Map<String, BigDecimal> out = new LinkedHashMap<>();
    record.fields().forEach((name, v) -> {
      if (JobAssembler.isTimeField(name) || JobAssembler.TIME_BUCKET.equals(name)) return;
      if (v instanceof BigDecimal) out.put(name, (BigDecimal) v);
    });
    return out;
  }

  static List<String> keyValues(JobRecord record, GroupingSpec g) {
    List<String> out = new ArrayList<>(g.fields().size());
    for (String f : g.fields()) {
      Object v = record.get(f);
      if (v == null) out.add(UNKNOWN_VALUE);
      else if (v instanceof BigDecimal) out.add(((BigDecimal) v).stripTrailingZeros().toPlainString());
      else out.add(v.toString());
    }
    return out;
  }

  public Map<BucketKey, Map<String, BigDecimal>> buckets(GroupingSpec g) {
    Map<BucketKey, Map<String, BigDecimal>> b = buckets.get(g);
    if (b == null) throw new IllegalArgumentException("Unknown grouping " + g);
    return Collections.unmodifiableMap(b);
  }

  /** Metric points for one grouping, ordered by bucket then name. */
  public List<MetricPoint> flatten(GroupingSpec g, String prefix) {
    // distinct keys can normalize to one metric name; their sums are merged
    TreeMap<Long, TreeMap<String, BigDecimal>> byBucket = new TreeMap<>();
    buckets(g).forEach((key, sums) -> {
      TreeMap<String, BigDecimal> named = byBucket.computeIfAbsent(key.timeBucket(), b -> new TreeMap<>());
      sums.forEach((metric, v) -> named.merge(MetricNames.name(prefix, g, key.values(), metric), v, BigDecimal::add));
    });

    List<MetricPoint> out = new ArrayList<>();
    byBucket.forEach((bucket, named) -> named.forEach((name, v) -> out.add(new MetricPoint(name, v, bucket))));
    return out;
  }
}
