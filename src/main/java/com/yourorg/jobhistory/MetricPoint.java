package com.yourorg.jobhistory;

import java.math.BigDecimal;

public class MetricPoint {
  public final String name;
  public final BigDecimal value;
  public final long timeBucket;

  public MetricPoint(String name, BigDecimal value, long timeBucket) {
    this.name = name;
    this.value = value;
    this.timeBucket = timeBucket;
  }

  @Override
  public String toString() {
    return name + " " + value.toPlainString() + " " + timeBucket;
  }
}
