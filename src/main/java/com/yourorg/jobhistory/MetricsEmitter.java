package com.yourorg.jobhistory;

import java.io.IOException;
import java.math.BigDecimal;

/**
 * Where aggregated metrics go. Transport, batching and retries are the sink's business.
 * <p>
 * Call order per run: for each grouping {@code beginProjection}, any number of
 * {@code emit(spec, ...)}, {@code endProjection}; then run statistics through
 * {@link #emit(String, BigDecimal, long)}; then {@link #finish()} once.
 */
public interface MetricsEmitter {

  void beginProjection(GroupingSpec spec) throws IOException;

  void emit(GroupingSpec spec, String name, BigDecimal value, long timestampSeconds) throws IOException;

  void endProjection(GroupingSpec spec) throws IOException;

  /** Run-level statistics (elapsed time, error counts). */
  void emit(String name, BigDecimal value, long timestampSeconds) throws IOException;

  /** Flushes and releases the sink. */
  void finish() throws IOException;
}
