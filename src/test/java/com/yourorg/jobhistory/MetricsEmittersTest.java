package com.yourorg.jobhistory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetricsEmittersTest {

  private static final GroupingSpec BY_USER = GroupingSpec.of("USER");

  @Test
  void consolePrintsNameValueTimestamp() {
    ByteArrayOutputStream buf = new ByteArrayOutputStream();
    ConsoleMetricsEmitter e = new ConsoleMetricsEmitter(new PrintStream(buf, true, StandardCharsets.UTF_8));

    e.beginProjection(BY_USER);
    e.emit(BY_USER, "USER.alice.CPU_MS.value", new BigDecimal("300"), 60);
    e.endProjection(BY_USER);
    e.emit("run.job_errors", BigDecimal.ZERO, 1700000000L);
    e.finish();

    assertEquals("USER.alice.CPU_MS.value 300 60\nrun.job_errors 0 1700000000\n",
        buf.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"));
  }

  @Test
  void jsonLinesWritesOneObjectPerMetric() throws Exception {
    StringWriter out = new StringWriter();
    JsonLinesMetricsEmitter e = new JsonLinesMetricsEmitter(out, false);

    e.beginProjection(BY_USER);
    e.emit(BY_USER, "USER.alice.LAUNCH_LATENCY.value", new BigDecimal("6.5"), 60);
    e.endProjection(BY_USER);
    e.emit("run.elapsed_seconds", new BigDecimal("1.25"), 1700000000L);
    e.finish();

    List<String> lines = out.toString().lines().toList();
    assertEquals(2, lines.size());

    ObjectMapper m = new ObjectMapper();
    JsonNode first = m.readTree(lines.get(0));
    assertEquals("USER", first.get("projection").asText());
    assertEquals("USER.alice.LAUNCH_LATENCY.value", first.get("name").asText());
    assertEquals(6.5, first.get("value").asDouble());
    assertEquals(60, first.get("timestamp").asLong());

    JsonNode second = m.readTree(lines.get(1));
    assertFalse(second.has("projection"));
    assertEquals("run.elapsed_seconds", second.get("name").asText());
  }

  @Test
  void factoryPicksSinkByName(@TempDir Path dir) throws Exception {
    MinerConfig c = new MinerConfig();
    assertInstanceOf(ConsoleMetricsEmitter.class, MetricsEmitters.create(c));

    c.sink = "jsonl";
    c.sinkOutput = dir.resolve("metrics.jsonl").toString();
    MetricsEmitter e = MetricsEmitters.create(c);
    assertInstanceOf(JsonLinesMetricsEmitter.class, e);
    e.emit("run.jobs_processed", BigDecimal.TEN, 1L);
    e.finish();
    assertTrue(Files.readString(dir.resolve("metrics.jsonl")).contains("\"run.jobs_processed\""));

    c.sink = "graphite";
    assertThrows(IllegalArgumentException.class, () -> MetricsEmitters.create(c));
  }
}
