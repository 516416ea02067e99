package com.yourorg.jobhistory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

public class MetricsEmitters {

  public static final String CONSOLE = "console";
  public static final String JSONL = "jsonl";

  public static MetricsEmitter create(MinerConfig config) throws IOException {
    String sink = config.sink == null ? CONSOLE : config.sink;
    return switch (sink) {
      case CONSOLE -> new ConsoleMetricsEmitter();
      case JSONL -> config.sinkOutput == null
          ? new JsonLinesMetricsEmitter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), false)
          : new JsonLinesMetricsEmitter(Files.newBufferedWriter(Path.of(config.sinkOutput), StandardCharsets.UTF_8), true);
      default -> throw new IllegalArgumentException("Unknown sink '" + sink + "', expected " + CONSOLE + " or " + JSONL);
    };
  }
}
