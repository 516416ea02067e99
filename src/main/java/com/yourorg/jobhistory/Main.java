package com.yourorg.jobhistory;

import java.io.IOException;
import java.nio.file.Path;

public class Main {
  public static void main(String[] args) {
    if (args.length < 1) {
      System.err.println("Usage: java -jar job-history-miner.jar <config.json> [historyRoot]");
      System.err.println("  historyRoot overrides the value in config.json");
      System.exit(1);
    }

    MinerConfig config;
    MetricsEmitter emitter;
    try {
      config = MinerConfig.read(Path.of(args[0]));
      if (args.length >= 2) config.historyRoot = args[1];
      config.validate();
      emitter = MetricsEmitters.create(config);
    } catch (IOException | IllegalArgumentException e) {
      System.err.println("Invalid config " + args[0] + ": " + e.getMessage());
      System.exit(1);
      return;
    }

    RunSummary summary;
    try {
      summary = new HistoryMiner(config, emitter).run();
    } catch (HistoryMiningException | IOException e) {
      System.err.println("Mining failed: " + e.getMessage());
      System.exit(2);
      return;
    }

    System.out.println("Elapsed: " + String.format("%.3f", summary.elapsedSeconds) + "s");
    System.out.println("Job parsing errors: " + summary.jobErrors);
    System.out.println("History matching errors: " + summary.historyErrors);
    System.out.println("Job name parsing errors: " + summary.jobNameErrors);
  }
}
