package io.finetl.campaign;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Run settings. {@link #fromEnv()} reads {@code finetl.*} system properties, falling back to {@code FINETL_*}
 * environment variables, then to the defaults of {@link #defaults(Path)}.
 */
public record ProcessorConfig(
        Path inputDir,
        int workers,
        int probeBytes,
        int sinkQueueCapacity,
        int sinkBatchSize,
        long sinkTimeoutMillis,
        int progressInterval,
        int topN,
        int expectedSubdivisions,
        double coverageThreshold,
        long volumeThreshold,
        double schemaDriftThreshold,
        int schemaDriftMinRows,
        boolean validateTaxIds,
        Optional<Path> reportJson,
        long metricsEverySeconds
) {
    public static final int DEFAULT_PROBE_BYTES = 32 * 1024;
    public static final long DEFAULT_VOLUME_THRESHOLD = 1_000_000;

    public ProcessorConfig {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1: " + workers);
        if (probeBytes < 1) throw new IllegalArgumentException("probeBytes must be >= 1: " + probeBytes);
        if (sinkQueueCapacity < 1 || sinkBatchSize < 1) throw new IllegalArgumentException("sink queue and batch must be >= 1");
        if (sinkTimeoutMillis < 1) throw new IllegalArgumentException("sinkTimeoutMillis must be >= 1: " + sinkTimeoutMillis);
        if (coverageThreshold < 0 || coverageThreshold > 1) throw new IllegalArgumentException("coverage must be in [0,1]: " + coverageThreshold);
        if (volumeThreshold < 0) throw new IllegalArgumentException("volumeThreshold must be >= 0: " + volumeThreshold);
        if (schemaDriftThreshold < 0 || schemaDriftThreshold > 1) throw new IllegalArgumentException("driftThreshold must be in [0,1]: " + schemaDriftThreshold);
        if (topN < 0 || expectedSubdivisions < 0 || progressInterval < 0 || schemaDriftMinRows < 0 || metricsEverySeconds < 0) {
            throw new IllegalArgumentException("counts and intervals must be >= 0");
        }
        reportJson = reportJson == null ? Optional.empty() : reportJson;
    }

    public static ProcessorConfig defaults(Path inputDir) {
        return new ProcessorConfig(inputDir, 4, DEFAULT_PROBE_BYTES, 1024, 256, 30_000, 10_000, 10, 27, 0.9, DEFAULT_VOLUME_THRESHOLD, 0.9, 10,
                false, Optional.empty(), 30);
    }

    public static ProcessorConfig fromEnv() {
        Path in = Path.of(setting("in", "."));
        int workers = Integer.parseInt(setting("workers", "4"));
        int probe = Integer.parseInt(setting("probeBytes", String.valueOf(DEFAULT_PROBE_BYTES)));
        int queue = Integer.parseInt(setting("sinkQueue", "1024"));
        int batch = Integer.parseInt(setting("sinkBatch", "256"));
        long timeout = Long.parseLong(setting("sinkTimeoutMs", "30000"));
        int progress = Integer.parseInt(setting("progressEvery", "10000"));
        int topN = Integer.parseInt(setting("topN", "10"));
        int subdivisions = Integer.parseInt(setting("subdivisions", "27"));
        double coverage = Double.parseDouble(setting("coverage", "0.9"));
        long volume = Long.parseLong(setting("volumeThreshold", String.valueOf(DEFAULT_VOLUME_THRESHOLD)));
        double drift = Double.parseDouble(setting("driftThreshold", "0.9"));
        int driftMin = Integer.parseInt(setting("driftMinRows", "10"));
        boolean taxIds = Boolean.parseBoolean(setting("validateTaxIds", "false"));
        String json = setting("reportJson", "");
        long metricsEvery = Long.parseLong(setting("metricsEverySec", "30"));
        return new ProcessorConfig(in, workers, probe, queue, batch, timeout, progress, topN, subdivisions, coverage,
                volume, drift, driftMin, taxIds, json.isBlank() ? Optional.empty() : Optional.of(Path.of(json)), metricsEvery);
    }

    // finetl.sinkTimeoutMs -> FINETL_SINK_TIMEOUT_MS
    static String envName(String key) {
        return "FINETL_" + key.replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT);
    }

    private static String setting(String key, String def) {
        return System.getProperty("finetl." + key, System.getenv().getOrDefault(envName(key), def));
    }

    public ProcessorConfig withWorkers(int n) {
        return new ProcessorConfig(inputDir, n, probeBytes, sinkQueueCapacity, sinkBatchSize, sinkTimeoutMillis,
                progressInterval, topN, expectedSubdivisions, coverageThreshold, volumeThreshold, schemaDriftThreshold, schemaDriftMinRows,
                validateTaxIds, reportJson, metricsEverySeconds);
    }

    public ProcessorConfig withProbeBytes(int n) {
        return new ProcessorConfig(inputDir, workers, n, sinkQueueCapacity, sinkBatchSize, sinkTimeoutMillis,
                progressInterval, topN, expectedSubdivisions, coverageThreshold, volumeThreshold, schemaDriftThreshold, schemaDriftMinRows,
                validateTaxIds, reportJson, metricsEverySeconds);
    }

    public ProcessorConfig withSink(int queueCapacity, int batchSize, long timeoutMillis) {
        return new ProcessorConfig(inputDir, workers, probeBytes, queueCapacity, batchSize, timeoutMillis,
                progressInterval, topN, expectedSubdivisions, coverageThreshold, volumeThreshold, schemaDriftThreshold, schemaDriftMinRows,
                validateTaxIds, reportJson, metricsEverySeconds);
    }

    public ProcessorConfig withValidateTaxIds(boolean enabled) {
        return new ProcessorConfig(inputDir, workers, probeBytes, sinkQueueCapacity, sinkBatchSize, sinkTimeoutMillis,
                progressInterval, topN, expectedSubdivisions, coverageThreshold, volumeThreshold, schemaDriftThreshold, schemaDriftMinRows,
                enabled, reportJson, metricsEverySeconds);
    }
}
