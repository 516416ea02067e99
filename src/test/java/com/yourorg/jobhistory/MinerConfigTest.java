package com.yourorg.jobhistory;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MinerConfigTest {

  @Test
  void loadsWithDefaults(@TempDir Path dir) throws IOException {
    Path f = Files.writeString(dir.resolve("miner.json"),
        "{\"historyRoot\": \"/data/history\", \"groupings\": [[\"USER\"], [\"USER\", \"JOB_QUEUE\"]]}");

    MinerConfig c = MinerConfig.load(f);

    assertEquals("/data/history", c.historyRoot);
    assertEquals(List.of(GroupingSpec.of("USER"), GroupingSpec.of("USER", "JOB_QUEUE")), c.groupingSpecs());
    assertEquals("SUBMIT_TIME", c.timeBucketField);
    assertEquals(60, c.timeBucketInterval);
    assertEquals(MiningMode.RELAXED, c.mode);
    assertFalse(c.jobNameMetadata.enabled);
    assertEquals("||", c.jobNameMetadata.separator);
    assertEquals("_conf.xml", c.configSuffix);
    assertEquals("console", c.sink);
    assertEquals("", c.metricPrefix);
  }

  @Test
  void loadsEveryOption(@TempDir Path dir) throws IOException {
    Path f = Files.writeString(dir.resolve("miner.json"), "{"
        + "\"historyRoot\": \"/h\", \"groupings\": [[\"SUBMIT_HOST\"]],"
        + "\"timeBucketField\": \"FINISH_TIME\", \"timeBucketInterval\": 300,"
        + "\"jobNameMetadata\": {\"enabled\": true, \"separator\": \";\", \"maxValueLength\": 8},"
        + "\"mode\": \"STRICT\", \"metricPrefix\": \"mr.\", \"configSuffix\": \"-conf.xml\","
        + "\"submitHostProperty\": \"mapred.job.submithost\", \"sink\": \"jsonl\", \"sinkOutput\": \"/tmp/m.jsonl\"}");

    MinerConfig c = MinerConfig.load(f);

    assertEquals("FINISH_TIME", c.timeBucketField);
    assertEquals(300, c.timeBucketInterval);
    assertTrue(c.jobNameMetadata.enabled);
    assertEquals(";", c.jobNameMetadata.separator);
    assertEquals(8, c.jobNameMetadata.maxValueLength);
    assertTrue(c.mode.isStrict());
    assertEquals("mr.", c.metricPrefix);
    assertEquals("-conf.xml", c.configSuffix);
    assertEquals("mapred.job.submithost", c.submitHostProperty);
    assertEquals("jsonl", c.sink);
    assertEquals("/tmp/m.jsonl", c.sinkOutput);
  }

  @Test
  void unknownPropertyIsRejected(@TempDir Path dir) throws IOException {
    Path f = Files.writeString(dir.resolve("miner.json"),
        "{\"historyRoot\": \"/h\", \"groupings\": [[\"USER\"]], \"bucketSize\": 60}");

    assertThrows(IOException.class, () -> MinerConfig.load(f));
  }

  @Test
  void validationRejectsIncompleteConfigs() {
    MinerConfig noRoot = new MinerConfig();
    noRoot.groupings = List.of(List.of("USER"));
    assertThrows(IllegalArgumentException.class, noRoot::validate);

    MinerConfig noGroupings = new MinerConfig();
    noGroupings.historyRoot = "/h";
    assertThrows(IllegalArgumentException.class, noGroupings::validate);

    MinerConfig emptyGrouping = new MinerConfig();
    emptyGrouping.historyRoot = "/h";
    emptyGrouping.groupings = List.of(List.of());
    assertThrows(IllegalArgumentException.class, emptyGrouping::validate);

    MinerConfig zeroInterval = new MinerConfig();
    zeroInterval.historyRoot = "/h";
    zeroInterval.groupings = List.of(List.of("USER"));
    zeroInterval.timeBucketInterval = 0;
    assertThrows(IllegalArgumentException.class, zeroInterval::validate);
  }
}
