package com.yourorg.jobhistory;

import java.util.*;

/**
 * Builds sink metric names: {@code <prefix><fields>.<values>.<metric>.value}.
 * {@code $} and {@code ,} are replaced because the sink uses them as name delimiters.
 */
public class MetricNames {

  public static final String EMPTY_VALUE = "empty-value";
  public static final String VALUE_SUFFIX = "value";

  public static String name(String prefix, GroupingSpec spec, List<String> keyValues, String metric) {
    StringJoiner j = new StringJoiner(".", prefix == null ? "" : prefix, "");
    for (String f : spec.fields()) j.add(normalize(f));
    for (String v : keyValues) j.add(normalize(v));
    j.add(normalize(metric));
    j.add(VALUE_SUFFIX);
    return j.toString();
  }

  public static String normalize(String s) {
    if (s == null) return EMPTY_VALUE;
    String t = s.trim();
    if (t.isEmpty()) return EMPTY_VALUE;
    return t.replace("$", "_dollar_").replace(",", "_comma_");
  }
}
