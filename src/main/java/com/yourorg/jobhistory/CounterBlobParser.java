package com.yourorg.jobhistory;

import java.util.*;
import java.util.regex.*;

/**
 * Decodes the counter blob written by the job tracker:
 * <pre>
 *   {(group)(group description)[(counter)(counter description)(value)]...}...
 * </pre>
 * Fields are matched lazily up to the next delimiter and there is no escaping, so a
 * field containing {@code )(}, {@code }} or {@code ]} is truncated at that point.
 */
public class CounterBlobParser {

  private static final Pattern GROUP_PATTERN =
      Pattern.compile("\\{\\((?<name>.*?)\\)\\((?<desc>.*?)\\)(?<body>.*?)\\}", Pattern.DOTALL);

  private static final Pattern COUNTER_PATTERN =
      Pattern.compile("\\[\\((?<name>.*?)\\)\\((?<desc>.*?)\\)\\((?<val>.*?)\\)\\]", Pattern.DOTALL);

  public static List<CounterGroup> parse(String blob) {
    if (blob == null || blob.isEmpty()) return List.of();

    List<CounterGroup> out = new ArrayList<>();
    Matcher gm = GROUP_PATTERN.matcher(blob);
    while (gm.find()) {
      CounterGroup g = new CounterGroup(sanitize(gm.group("name")), gm.group("desc"));

      Matcher cm = COUNTER_PATTERN.matcher(gm.group("body"));
      while (cm.find()) {
        g.counters.add(new CounterGroup.Counter(sanitize(cm.group("name")), cm.group("desc"), cm.group("val")));
      }
      out.add(g);
    }
    return out;
  }

  static String sanitize(String name) {
    return name.replace("\\", "").replace('.', '_');
  }
}
