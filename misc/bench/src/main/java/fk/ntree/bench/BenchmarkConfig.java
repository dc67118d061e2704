package fk.ntree.bench;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Settings of a benchmark run, read from a json file.
 */
public class BenchmarkConfig {

    private static final ObjectMapper om = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    @JsonProperty("root.path")
    private String rootPath;

    @JsonProperty("scanner.threads")
    private Integer scannerThreads = DriveScanner.DEFAULT_WORKER_COUNT;

    @JsonProperty("trial.count")
    private Integer trialCount = 100;

    @JsonProperty("progress.interval.ms")
    private Long progressIntervalMs = 1000L;

    // no export when absent
    @JsonProperty("dot.output.path")
    private String dotOutputPath;

    public static BenchmarkConfig load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    /**
     * @throws IOException              if the content is not a valid config json
     * @throws IllegalArgumentException if a value is missing or out of range
     */
    public static BenchmarkConfig load(InputStream in) throws IOException {
        BenchmarkConfig config = om.readValue(in, BenchmarkConfig.class);
        config.validate();
        return config;
    }

    /**
     * Default settings for scanning the given directory.
     */
    public static BenchmarkConfig forRoot(String rootPath) {
        BenchmarkConfig config = new BenchmarkConfig();
        config.rootPath = rootPath;
        config.validate();
        return config;
    }

    public Path getRootPath() {
        return Paths.get(rootPath);
    }

    public Integer getScannerThreads() {
        return scannerThreads;
    }

    public Integer getTrialCount() {
        return trialCount;
    }

    public Long getProgressIntervalMs() {
        return progressIntervalMs;
    }

    /**
     * @return null if the tree is not to be exported
     */
    public Path getDotOutputPath() {
        return dotOutputPath == null ? null : Paths.get(dotOutputPath);
    }

    private void validate() {
        Preconditions.checkArgument(rootPath != null && !rootPath.isEmpty(), "root.path is required");
        Preconditions.checkArgument(scannerThreads != null && scannerThreads > 0, "scanner.threads must be positive");
        Preconditions.checkArgument(trialCount != null && trialCount > 0, "trial.count must be positive");
        Preconditions.checkArgument(progressIntervalMs != null && progressIntervalMs > 0, "progress.interval.ms must be positive");
    }
}
