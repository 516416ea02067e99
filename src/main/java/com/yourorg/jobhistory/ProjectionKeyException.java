package com.yourorg.jobhistory;

public class ProjectionKeyException extends HistoryMiningException {
  public ProjectionKeyException(String message) {
    super(message);
  }
}
