package com.yourorg.jobhistory;

public class ConfigFilename {
  public final String trackerId;
  public final String trackerStartTime;
  public final String jobTimestamp;
  public final String jobNumber;

  public ConfigFilename(String trackerId, String trackerStartTime, String jobTimestamp, String jobNumber) {
    this.trackerId = trackerId;
    this.trackerStartTime = trackerStartTime;
    this.jobTimestamp = jobTimestamp;
    this.jobNumber = jobNumber;
  }

  public static ConfigFilename parse(String fileName) {
    String[] parts = fileName.split("_", -1);
    if (parts.length != 6) throw new FilenameFormatException(fileName, parts.length);
    return new ConfigFilename(parts[0], parts[1], parts[3], parts[4]);
  }

  public String jobId() {
    return "job_" + jobTimestamp + "_" + jobNumber;
  }
}
