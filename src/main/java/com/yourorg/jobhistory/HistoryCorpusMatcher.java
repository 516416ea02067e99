package com.yourorg.jobhistory;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairs each config document under the history root with the runtime log of the same job.
 * <p>
 * A runtime log belongs to a config when its file name contains the config's job id.
 * Candidates are tried in lexicographic path order and the first hit wins. Matching is
 * O(configs x runtime logs).
 */
public class HistoryCorpusMatcher {
  private static final Logger log = LoggerFactory.getLogger(HistoryCorpusMatcher.class);

  public static final String DEFAULT_CONFIG_SUFFIX = "_conf.xml";
  public static final String CHECKSUM_SUFFIX = ".crc";

  private final String configSuffix;
  private final MiningMode mode;

  public HistoryCorpusMatcher(String configSuffix, MiningMode mode) {
    this.configSuffix = configSuffix != null ? configSuffix : DEFAULT_CONFIG_SUFFIX;
    this.mode = mode;
  }

  public static class HistoryPair {
    public final Path configFile;
    public final Path runtimeFile;
    public final ConfigFilename name;

    public HistoryPair(Path configFile, Path runtimeFile, ConfigFilename name) {
      this.configFile = configFile;
      this.runtimeFile = runtimeFile;
      this.name = name;
    }

    public String jobId() {
      return name.jobId();
    }
  }

  public static class MatchResult {
    public List<HistoryPair> pairs = new ArrayList<>();
    public int errors;
  }

  public MatchResult match(Path root) throws IOException {
    List<Path> configs = new ArrayList<>();
    List<Path> runtimes = new ArrayList<>();

    try (Stream<Path> walk = Files.walk(root)) {
      walk.filter(Files::isRegularFile).sorted().forEach(p -> {
        String n = p.getFileName().toString();
        if (n.endsWith(configSuffix)) configs.add(p);
        else if (!n.endsWith(CHECKSUM_SUFFIX)) runtimes.add(p);
      });
    }
    log.info("Found {} config documents and {} runtime log candidates under {}", configs.size(), runtimes.size(), root);

    MatchResult out = new MatchResult();
    for (Path config : configs) {
      ConfigFilename name = ConfigFilename.parse(config.getFileName().toString());
      String jobId = name.jobId();

      Path runtime = firstContaining(runtimes, jobId);
      if (runtime == null) {
        if (mode.isStrict()) throw new MissingMatchException(config, jobId);
        out.errors++;
        log.warn("No runtime log for {} ({}), skipping", jobId, config);
        continue;
      }
      out.pairs.add(new HistoryPair(config, runtime, name));
    }
    return out;
  }

  private static Path firstContaining(List<Path> candidates, String jobId) {
    for (Path p : candidates) {
      if (p.getFileName().toString().contains(jobId)) return p;
    }
    return null;
  }
}
