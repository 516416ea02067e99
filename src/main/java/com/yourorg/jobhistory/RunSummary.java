package com.yourorg.jobhistory;

public class RunSummary {
  public double elapsedSeconds;

  public int jobsMatched;
  public int jobsProcessed;

  public int jobErrors;
  public int historyErrors;
  public int jobNameErrors;
  public int projectionErrors;

  @Override
  public String toString() {
    return String.format("Elapsed %.3fs, jobs processed=%d/%d, job parsing errors=%d, "
            + "history matching errors=%d, job name parsing errors=%d, projection errors=%d",
        elapsedSeconds, jobsProcessed, jobsMatched, jobErrors, historyErrors, jobNameErrors, projectionErrors);
  }
}
