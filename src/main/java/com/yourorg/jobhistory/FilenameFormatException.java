package com.yourorg.jobhistory;

// always fatal: the corpus cannot be navigated
public class FilenameFormatException extends HistoryMiningException {
  public FilenameFormatException(String fileName, int parts) {
    super("Config file name '" + fileName + "' has " + parts + " '_'-separated parts, expected 6");
  }
}
