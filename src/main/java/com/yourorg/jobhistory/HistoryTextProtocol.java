package com.yourorg.jobhistory;

import java.util.*;

/**
 * The two halves of one text contract between the runtime log reader and the
 * job-name metadata extractor.
 * <p>
 * {@link #maskEquals(String)} turns every {@code =} into a space before the log is
 * tokenized, so {@code KEY="VALUE"} becomes {@code KEY "VALUE"}. A side effect is that a
 * user-authored {@code key=value} inside the job name arrives as {@code key value}, which
 * is what {@link #splitJobNameMetadata} splits on. Change one and the other breaks.
 */
public final class HistoryTextProtocol {

  public static final String TOO_LONG = "toolong";

  private HistoryTextProtocol() {}

  /** Lossy: no field value survives with a literal {@code =}. */
  public static String maskEquals(String raw) {
    return raw.replace('=', ' ');
  }

  /**
   * Splits a masked job name into metadata fields.
   *
   * @return the extracted fields, or empty if the name cannot be split (a control
   *     character in the name, or a pair without a space); nothing is partially extracted
   */
  public static Optional<Map<String, String>> splitJobNameMetadata(
      String jobName, MinerConfig.JobNameMetadata options) {
    if (jobName.indexOf('\n') >= 0 || jobName.indexOf('\t') >= 0) return Optional.empty();

    Map<String, String> out = new LinkedHashMap<>();
    for (String pair : splitLiteral(jobName, options.separator)) {
      int sp = pair.indexOf(' ');
      if (sp <= 0) return Optional.empty();

      String key = pair.substring(0, sp);
      String value = pair.substring(sp + 1);
      if (value.length() > options.maxValueLength) value = TOO_LONG;
      out.put(key, value);
    }
    return Optional.of(out);
  }

  private static List<String> splitLiteral(String s, String separator) {
    if (separator == null || separator.isEmpty()) return List.of(s);

    List<String> parts = new ArrayList<>();
    int from = 0;
    int at;
    while ((at = s.indexOf(separator, from)) >= 0) {
      parts.add(s.substring(from, at));
      from = at + separator.length();
    }
    parts.add(s.substring(from));
    return parts;
  }
}
