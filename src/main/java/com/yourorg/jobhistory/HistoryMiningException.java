package com.yourorg.jobhistory;

public class HistoryMiningException extends RuntimeException {
  public HistoryMiningException(String message) {
    super(message);
  }

  public HistoryMiningException(String message, Throwable cause) {
    super(message, cause);
  }
}
