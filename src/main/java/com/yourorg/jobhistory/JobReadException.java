package com.yourorg.jobhistory;

import java.io.IOException;

public class JobReadException extends HistoryMiningException {
  public JobReadException(String jobId, IOException cause) {
    super("Cannot read history files of " + jobId + ": " + cause.getMessage(), cause);
  }
}
