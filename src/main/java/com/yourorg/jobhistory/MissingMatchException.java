package com.yourorg.jobhistory;

import java.nio.file.Path;

public class MissingMatchException extends HistoryMiningException {
  public MissingMatchException(Path configFile, String jobId) {
    super("No runtime log found for " + jobId + " (config " + configFile + ")");
  }
}
