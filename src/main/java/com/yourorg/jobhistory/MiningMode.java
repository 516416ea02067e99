package com.yourorg.jobhistory;

public enum MiningMode {
  RELAXED,
  STRICT;

  public boolean isStrict() {
    return this == STRICT;
  }
}
