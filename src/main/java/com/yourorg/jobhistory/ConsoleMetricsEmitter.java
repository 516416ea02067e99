package com.yourorg.jobhistory;

import java.io.PrintStream;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Prints {@code name value timestamp} lines, one per metric. */
public class ConsoleMetricsEmitter implements MetricsEmitter {
  private static final Logger log = LoggerFactory.getLogger(ConsoleMetricsEmitter.class);

  private final PrintStream out;
  private long emitted;

  public ConsoleMetricsEmitter() {
    this(System.out);
  }

  public ConsoleMetricsEmitter(PrintStream out) {
    this.out = out;
  }

  @Override
  public void beginProjection(GroupingSpec spec) {
    log.info("Emitting projection [{}]", spec);
  }

  @Override
  public void emit(GroupingSpec spec, String name, BigDecimal value, long timestampSeconds) {
    emit(name, value, timestampSeconds);
  }

  @Override
  public void endProjection(GroupingSpec spec) {
    log.info("Finished projection [{}]", spec);
  }

  @Override
  public void emit(String name, BigDecimal value, long timestampSeconds) {
    out.println(name + " " + value.toPlainString() + " " + timestampSeconds);
    emitted++;
  }

  @Override
  public void finish() {
    out.flush();
    log.info("Emitted {} metrics", emitted);
  }
}
