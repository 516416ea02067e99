package com.yourorg.jobhistory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;
import java.util.zip.GZIPInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one job's runtime log into a flat field map.
 * <p>
 * Only {@code Job} records contribute. Counter blobs are decoded and flattened to
 * {@code <field>.<group>.<counter>}, and {@code JOB_STATUS} becomes a presence field.
 */
public class RuntimeRecordParser {
  private static final Logger log = LoggerFactory.getLogger(RuntimeRecordParser.class);

  public static final String JOB_RECORD = "Job";
  public static final String COUNTERS_MARKER = "COUNTERS";
  public static final String JOBNAME = "JOBNAME";
  public static final String JOB_STATUS = "JOB_STATUS";

  private final MinerConfig.JobNameMetadata jobNameMetadata;

  public RuntimeRecordParser(MinerConfig.JobNameMetadata jobNameMetadata) {
    this.jobNameMetadata = jobNameMetadata;
  }

  public ParsedRuntimeLog parse(Path runtimeLog) throws IOException {
    String raw;
    try (InputStream in = open(runtimeLog)) {
      raw = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
    ParsedRuntimeLog out = parseText(raw);
    log.debug("Parsed {} fields from {}", out.fields.size(), runtimeLog);
    return out;
  }

  public ParsedRuntimeLog parseText(String raw) {
    ParsedRuntimeLog out = new ParsedRuntimeLog();
    String masked = HistoryTextProtocol.maskEquals(raw);

    for (List<String> record : RuntimeLogTokenizer.tokenize(masked)) {
      if (!JOB_RECORD.equals(record.get(0))) continue;
      for (int i = 1; i + 1 < record.size(); i += 2) {
        out.fields.put(record.get(i), record.get(i + 1));
      }
    }

    flattenCounters(decodeCounters(out.fields), out.fields);

    if (jobNameMetadata != null && jobNameMetadata.enabled) {
      out.jobNameParseFailed = !extractJobNameMetadata(out.fields);
    }
    replaceJobStatus(out.fields);
    return out;
  }

  private InputStream open(Path file) throws IOException {
    InputStream fis = Files.newInputStream(file);
    return file.toString().endsWith(".gz") ? new GZIPInputStream(fis) : fis;
  }

  /** Removes every {@code *COUNTERS*} text value from {@code fields} and returns its decoded groups. */
  static Map<String, List<CounterGroup>> decodeCounters(Map<String, Object> fields) {
    Map<String, List<CounterGroup>> decoded = new LinkedHashMap<>();
    Iterator<Map.Entry<String, Object>> it = fields.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, Object> e = it.next();
      if (e.getKey().contains(COUNTERS_MARKER) && e.getValue() instanceof String) {
        decoded.put(e.getKey(), CounterBlobParser.parse((String) e.getValue()));
        it.remove();
      }
    }
    return decoded;
  }

  static void flattenCounters(Map<String, List<CounterGroup>> decoded, Map<String, Object> fields) {
    decoded.forEach((field, groups) -> {
      for (CounterGroup g : groups) {
        for (CounterGroup.Counter c : g.counters) {
          fields.put(field + "." + g.name + "." + c.name, c.value);
        }
      }
    });
  }

  private boolean extractJobNameMetadata(Map<String, Object> fields) {
    Object name = fields.get(JOBNAME);
    if (!(name instanceof String)) return true;

    Optional<Map<String, String>> meta =
        HistoryTextProtocol.splitJobNameMetadata((String) name, jobNameMetadata);
    if (meta.isEmpty()) {
      log.debug("Job name is not in metadata form: {}", name);
      return false;
    }
    fields.putAll(meta.get());
    return true;
  }

  static void replaceJobStatus(Map<String, Object> fields) {
    Object status = fields.remove(JOB_STATUS);
    if (status != null) fields.put(JOB_STATUS + "." + status, "1");
  }
}
