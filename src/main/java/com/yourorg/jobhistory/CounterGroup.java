package com.yourorg.jobhistory;

import java.util.*;

public class CounterGroup {
  public String name;
  public String description;
  public List<Counter> counters = new ArrayList<>();

  public CounterGroup() {}

  public CounterGroup(String name, String description) {
    this.name = name;
    this.description = description;
  }

  public static class Counter {
    public String name;
    public String description;
    public String value; // numeric text, converted during assembly

    public Counter() {}

    public Counter(String name, String description, String value) {
      this.name = name;
      this.description = description;
      this.value = value;
    }
  }
}
