package com.yourorg.jobhistory;

import java.util.*;

public class ParsedRuntimeLog {
  public Map<String, Object> fields = new LinkedHashMap<>();

  // set when job-name metadata extraction was on and the name could not be split
  public boolean jobNameParseFailed;
}
