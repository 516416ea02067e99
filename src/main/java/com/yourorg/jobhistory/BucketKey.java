package com.yourorg.jobhistory;

import java.util.*;

public final class BucketKey {
  private final long timeBucket;
  private final List<String> values;

  public BucketKey(long timeBucket, List<String> values) {
    this.timeBucket = timeBucket;
    this.values = List.copyOf(values);
  }

  public long timeBucket() {
    return timeBucket;
  }

  public List<String> values() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof BucketKey)) return false;
    BucketKey k = (BucketKey) o;
    return timeBucket == k.timeBucket && values.equals(k.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(timeBucket, values);
  }

  @Override
  public String toString() {
    return timeBucket + ":" + values;
  }
}
