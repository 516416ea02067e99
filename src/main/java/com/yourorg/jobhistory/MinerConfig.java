package com.yourorg.jobhistory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

public class MinerConfig {
  private static final ObjectMapper M = new ObjectMapper()
      .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  public String historyRoot;
  public List<List<String>> groupings = new ArrayList<>();

  public String timeBucketField = JobAssembler.SUBMIT_TIME;
  public long timeBucketInterval = 60;

  public JobNameMetadata jobNameMetadata = new JobNameMetadata();
  public MiningMode mode = MiningMode.RELAXED;
  public String metricPrefix = "";

  public String configSuffix = HistoryCorpusMatcher.DEFAULT_CONFIG_SUFFIX;
  public String submitHostProperty = ConfigDocParser.DEFAULT_SUBMIT_HOST_PROPERTY;

  public String sink = MetricsEmitters.CONSOLE;
  public String sinkOutput; // jsonl only; stdout when null

  public static class JobNameMetadata {
    public boolean enabled;
    public String separator = "||";
    public int maxValueLength = 64;
  }

  public static MinerConfig load(Path file) throws IOException {
    MinerConfig c = read(file);
    c.validate();
    return c;
  }

  public static MinerConfig read(Path file) throws IOException {
    return M.readValue(Files.readString(file), MinerConfig.class);
  }

  public void validate() {
    if (historyRoot == null || historyRoot.isBlank())
      throw new IllegalArgumentException("historyRoot is required");
    if (groupings == null || groupings.isEmpty())
      throw new IllegalArgumentException("at least one grouping is required");
    for (List<String> g : groupings) {
      if (g == null || g.isEmpty())
        throw new IllegalArgumentException("grouping must name at least one field: " + g);
    }
    if (timeBucketInterval <= 0)
      throw new IllegalArgumentException("timeBucketInterval must be > 0, was " + timeBucketInterval);
    if (timeBucketField == null || timeBucketField.isBlank())
      throw new IllegalArgumentException("timeBucketField is required");
    if (jobNameMetadata == null) jobNameMetadata = new JobNameMetadata();
    if (jobNameMetadata.maxValueLength < 0)
      throw new IllegalArgumentException("jobNameMetadata.maxValueLength must be >= 0");
    if (mode == null) mode = MiningMode.RELAXED;
    if (metricPrefix == null) metricPrefix = "";
  }

  public List<GroupingSpec> groupingSpecs() {
    List<GroupingSpec> out = new ArrayList<>();
    for (List<String> g : groupings) out.add(new GroupingSpec(g));
    return out;
  }
}
