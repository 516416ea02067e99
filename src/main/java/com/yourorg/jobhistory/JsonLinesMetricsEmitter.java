package com.yourorg.jobhistory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.*;
import java.math.BigDecimal;

public class JsonLinesMetricsEmitter implements MetricsEmitter {
  private static final ObjectMapper M = new ObjectMapper();

  private final Writer out;
  private final boolean closeOnFinish;

  public JsonLinesMetricsEmitter(Writer out, boolean closeOnFinish) {
    this.out = out;
    this.closeOnFinish = closeOnFinish;
  }

  @Override
  public void beginProjection(GroupingSpec spec) {}

  @Override
  public void emit(GroupingSpec spec, String name, BigDecimal value, long timestampSeconds) throws IOException {
    write(spec.toString(), name, value, timestampSeconds);
  }

  @Override
  public void endProjection(GroupingSpec spec) throws IOException {
    out.flush();
  }

  @Override
  public void emit(String name, BigDecimal value, long timestampSeconds) throws IOException {
    write(null, name, value, timestampSeconds);
  }

  private void write(String projection, String name, BigDecimal value, long timestampSeconds) throws IOException {
    ObjectNode n = M.createObjectNode();
    if (projection != null) n.put("projection", projection);
    n.put("name", name);
    n.put("value", value);
    n.put("timestamp", timestampSeconds);
    out.write(M.writeValueAsString(n));
    out.write('\n');
  }

  @Override
  public void finish() throws IOException {
    out.flush();
    if (closeOnFinish) out.close();
  }
}
