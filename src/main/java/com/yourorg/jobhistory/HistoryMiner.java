package com.yourorg.jobhistory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.util.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HistoryMiner {
  private static final Logger log = LoggerFactory.getLogger(HistoryMiner.class);

  private final MinerConfig config;
  private final MetricsEmitter emitter;
  private final Clock clock;

  public HistoryMiner(MinerConfig config, MetricsEmitter emitter) {
    this(config, emitter, Clock.systemUTC());
  }

  public HistoryMiner(MinerConfig config, MetricsEmitter emitter, Clock clock) {
    config.validate();
    this.config = config;
    this.emitter = emitter;
    this.clock = clock;
  }

  public RunSummary run() throws IOException {
    try {
      return mine();
    } finally {
      emitter.finish();
    }
  }

  private RunSummary mine() throws IOException {
    long started = System.nanoTime();
    RunSummary summary = new RunSummary();
    MiningMode mode = config.mode;

    HistoryCorpusMatcher.MatchResult matched =
        new HistoryCorpusMatcher(config.configSuffix, mode).match(Path.of(config.historyRoot));
    summary.jobsMatched = matched.pairs.size();
    summary.historyErrors = matched.errors;

    List<JobRecord> records = assembleAll(matched.pairs, summary);
    summary.jobsProcessed = records.size();

    AggregationEngine engine = new AggregationEngine(config.groupingSpecs(), mode);
    engine.addAll(records);
    summary.projectionErrors = engine.projectionErrors();

    for (GroupingSpec g : engine.groupings()) {
      emitter.beginProjection(g);
      for (MetricPoint p : engine.flatten(g, config.metricPrefix)) {
        emitter.emit(g, p.name, p.value, p.timeBucket);
      }
      emitter.endProjection(g);
    }

    summary.elapsedSeconds = (System.nanoTime() - started) / 1e9;
    emitRunStatistics(summary);

    log.info("{}", summary);
    return summary;
  }

  private List<JobRecord> assembleAll(List<HistoryCorpusMatcher.HistoryPair> pairs, RunSummary summary) {
    ConfigDocParser configParser = new ConfigDocParser(config.submitHostProperty);
    RuntimeRecordParser runtimeParser = new RuntimeRecordParser(config.jobNameMetadata);
    JobAssembler assembler = new JobAssembler(config.timeBucketField, config.timeBucketInterval);

    List<JobRecord> out = new ArrayList<>(pairs.size());
    for (HistoryCorpusMatcher.HistoryPair pair : pairs) {
      try {
        Map<String, String> conf = configParser.parse(pair.configFile);
        ParsedRuntimeLog runtime = runtimeParser.parse(pair.runtimeFile);
        if (runtime.jobNameParseFailed) summary.jobNameErrors++;

        out.add(assembler.assemble(runtime.fields, conf));
      } catch (IOException e) {
        if (config.mode.isStrict()) throw new JobReadException(pair.jobId(), e);
        summary.jobErrors++;
        log.warn("Skipping {}: {}", pair.jobId(), e.getMessage());
      } catch (RecordAssemblyException e) {
        if (config.mode.isStrict()) throw e;
        summary.jobErrors++;
        log.warn("Skipping {}: {}", pair.jobId(), e.getMessage());
      }
    }
    log.info("Assembled {} of {} matched jobs", out.size(), pairs.size());
    return out;
  }

  private void emitRunStatistics(RunSummary s) throws IOException {
    long now = clock.instant().getEpochSecond();
    String p = config.metricPrefix + "run.";

    emitter.emit(p + "elapsed_seconds", BigDecimal.valueOf(s.elapsedSeconds), now);
    emitter.emit(p + "jobs_processed", BigDecimal.valueOf(s.jobsProcessed), now);
    emitter.emit(p + "job_errors", BigDecimal.valueOf(s.jobErrors), now);
    emitter.emit(p + "history_errors", BigDecimal.valueOf(s.historyErrors), now);
    emitter.emit(p + "jobname_errors", BigDecimal.valueOf(s.jobNameErrors), now);
    emitter.emit(p + "projection_errors", BigDecimal.valueOf(s.projectionErrors), now);
  }
}
