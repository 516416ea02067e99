package com.yourorg.jobhistory;

public class RecordAssemblyException extends HistoryMiningException {
  public RecordAssemblyException(String message) {
    super(message);
  }

  public RecordAssemblyException(String message, Throwable cause) {
    super(message, cause);
  }
}
