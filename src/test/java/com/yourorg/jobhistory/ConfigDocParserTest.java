package com.yourorg.jobhistory;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDocParserTest {

  private static final String NAME = "tracker01_1325376000123_job_201201010000_0001_conf.xml";

  private static ByteArrayInputStream xml(String s) {
    return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void parsesSixPartFileName() {
    ConfigFilename n = ConfigFilename.parse(NAME);

    assertEquals("tracker01", n.trackerId);
    assertEquals("1325376000123", n.trackerStartTime);
    assertEquals("201201010000", n.jobTimestamp);
    assertEquals("0001", n.jobNumber);
    assertEquals("job_201201010000_0001", n.jobId());
  }

  @Test
  void rejectsFileNameWithoutSixParts() {
    assertThrows(FilenameFormatException.class, () -> ConfigFilename.parse("job_201201010000_0001_conf.xml"));
    assertThrows(FilenameFormatException.class, () -> ConfigFilename.parse("a_b_c_d_e_f_g"));
    assertThrows(FilenameFormatException.class, () -> ConfigFilename.parse("a_b_c_d_e__"));
  }

  @Test
  void readsPropertiesAndDerivedFields() throws IOException {
    Map<String, String> f = new ConfigDocParser(null)
        .parse(ConfigFilename.parse(NAME), xml(HistoryFixtures.configXml("gateway01.example.com", "etl")));

    assertEquals("etl", f.get("mapred.job.queue.name"));
    assertEquals("1", f.get("mapreduce.job.reduces"));
    assertEquals("job_201201010000_0001", f.get("JOBID"));
    assertEquals("1325376000123", f.get("JOBTRACKER_START_TIME"));
    assertEquals("0001", f.get("JOB_NUMBER"));
    assertEquals("gateway01_example_com", f.get("SUBMIT_HOST"));
    assertFalse(f.containsKey("source"));
  }

  @Test
  void missingHostUsesSentinel() throws IOException {
    Map<String, String> f = new ConfigDocParser(null)
        .parse(ConfigFilename.parse(NAME), xml(HistoryFixtures.configXml(null, "etl")));

    assertEquals("unknown-host", f.get("SUBMIT_HOST"));
  }

  @Test
  void hostPropertyIsConfigurable() throws IOException {
    Map<String, String> f = new ConfigDocParser("mapred.job.queue.name")
        .parse(ConfigFilename.parse(NAME), xml(HistoryFixtures.configXml("gw.example.com", "q.one")));

    assertEquals("q_one", f.get("SUBMIT_HOST"));
  }

  @Test
  void emptyValueIsKept() throws IOException {
    Map<String, String> f = ConfigDocParser.readProperties(xml(
        "<configuration><property><name>a</name><value></value></property>"
            + "<property><name>b</name></property></configuration>"));

    assertEquals(Map.of("a", "", "b", ""), f);
  }

  @Test
  void malformedDocumentIsAnIoError() {
    assertThrows(IOException.class,
        () -> ConfigDocParser.readProperties(xml("<configuration><property><name>a</name>")));
  }

  @Test
  void parsesFromDisk(@TempDir Path dir) throws IOException {
    Path file = HistoryFixtures.write(dir, NAME, HistoryFixtures.configXml("h", "etl"));

    assertEquals("job_201201010000_0001", new ConfigDocParser(null).parse(file).get("JOBID"));
  }
}
