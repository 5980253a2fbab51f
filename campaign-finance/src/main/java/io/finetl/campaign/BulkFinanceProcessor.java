package io.finetl.campaign;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.finetl.core.Record;
import io.finetl.core.Sink;
import io.finetl.metrics.Metrics;
import io.finetl.runtime.SinkDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the whole bulk load of one directory: classify, then read and validate files on a fixed pool of workers,
 * hand valid records to the sink, and report.
 * <p>
 * Each worker owns one file at a time and reads it row by row; the only state workers share is the
 * {@link Aggregator} and the sink hand-off. {@link #cancel()} (or interrupting the thread inside {@link #run(Path)})
 * stops new files from starting, and files in flight stop at their next row and are counted as far as they got.
 * An instance runs one directory at a time and can be reused; each run starts uncancelled.
 */
public class BulkFinanceProcessor {
    private static final Logger log = LoggerFactory.getLogger(BulkFinanceProcessor.class);
    private static final long SINK_FLUSH_MILLIS = 200;

    private final ProcessorConfig config;
    private final FileClassifier classifier;
    private final EncodingDetector detector;
    private final RecordValidator validator;
    private final ReportGenerator reports;
    private final Sink<FinanceRecord> sink;
    private final Metrics metrics;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final Meter rowsMeter;
    private final Meter validMeter;
    private final Meter invalidMeter;
    private final Timer fileTimer;
    private final Counter skippedCounter;
    private final Counter failedCounter;

    public BulkFinanceProcessor(ProcessorConfig config,
                                FileClassifier classifier,
                                EncodingDetector detector,
                                RecordValidator validator,
                                ReportGenerator reports,
                                Sink<FinanceRecord> sink,
                                Metrics metrics) {
        this.config = Objects.requireNonNull(config);
        this.classifier = Objects.requireNonNull(classifier);
        this.detector = Objects.requireNonNull(detector);
        this.validator = Objects.requireNonNull(validator);
        this.reports = Objects.requireNonNull(reports);
        this.sink = Objects.requireNonNull(sink);
        this.metrics = Objects.requireNonNull(metrics);
        this.rowsMeter = metrics.meter("processor.rows.rate");
        this.validMeter = metrics.meter("processor.valid.rate");
        this.invalidMeter = metrics.meter("processor.invalid.rate");
        this.fileTimer = metrics.timer("processor.file.time");
        this.skippedCounter = metrics.counter("processor.files.skipped");
        this.failedCounter = metrics.counter("processor.files.failed");
    }

    /**
     * Process every classified file under {@code dir}.
     *
     * @throws IOException if the directory cannot be listed; nothing has been processed in that case
     * @throws IllegalStateException if another run of this instance is in progress
     */
    public ProcessingReport run(Path dir) throws IOException {
        if (!running.compareAndSet(false, true)) throw new IllegalStateException("a run is already in progress");
        try {
            cancelled.set(false);
            return runOnce(dir);
        } finally {
            running.set(false);
        }
    }

    private ProcessingReport runOnce(Path dir) throws IOException {
        long t0 = System.nanoTime();
        Classification classification = classifier.classify(dir);
        skippedCounter.inc(classification.skipped().size());
        log.info("{}: {} files to process, {} skipped", dir, classification.classifiedCount(), classification.skipped().size());
        for (Path p : classification.skipped()) log.debug("skipped unclassified file {}", p.getFileName());

        Aggregator aggregator = new Aggregator();
        List<FileStats> completed = Collections.synchronizedList(new ArrayList<>());
        Queue<FileDescriptor> pending = new ConcurrentLinkedQueue<>(classification.all());

        SinkDispatcher<FinanceRecord> dispatcher = new SinkDispatcher<>(sink, config.sinkQueueCapacity(),
                config.sinkBatchSize(), SINK_FLUSH_MILLIS, metrics);
        dispatcher.start();

        int workers = Math.max(1, Math.min(config.workers(), classification.classifiedCount()));
        AtomicInteger threadIds = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "bulk-worker-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < workers; i++) {
            pool.execute(() -> drain(pending, dispatcher, aggregator, completed));
        }
        pool.shutdown();
        boolean interrupted = awaitWorkers(pool);

        if (!dispatcher.finish(config.sinkTimeoutMillis())) {
            log.warn("sink did not drain within {} ms", config.sinkTimeoutMillis());
        }
        Duration wall = Duration.ofNanos(System.nanoTime() - t0);
        ProcessingReport report;
        synchronized (completed) {
            report = reports.generate(aggregator.snapshot(), new ArrayList<>(completed), classification.skipped(), wall,
                    cancelled.get(), dispatcher.failures());
        }
        AggregateStats s = report.stats();
        log.info("{}: {} files, {} records ({} valid, {} invalid) in {} ms{}", dir, s.filesProcessed(), s.totalRecords(),
                s.validRecords(), s.invalidRecords(), wall.toMillis(), report.cancelled() ? " (cancelled)" : "");
        if (interrupted) Thread.currentThread().interrupt();
        return report;
    }

    /** Request cancellation of the current run. Idempotent; the next {@link #run(Path)} clears it. */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.warn("cancellation requested; no new files will start");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    // An interrupt turns into cancellation; workers still get to fold in what they read.
    private boolean awaitWorkers(ExecutorService pool) {
        boolean interrupted = false;
        while (true) {
            try {
                if (pool.awaitTermination(1, TimeUnit.SECONDS)) return interrupted;
            } catch (InterruptedException e) {
                interrupted = true;
                cancel();
            }
        }
    }

    private void drain(Queue<FileDescriptor> pending, SinkDispatcher<FinanceRecord> dispatcher,
                       Aggregator aggregator, List<FileStats> completed) {
        FileDescriptor next;
        while (!cancelled.get() && (next = pending.poll()) != null) {
            FileStats stats;
            try {
                stats = processFile(next, dispatcher);
            } catch (RuntimeException e) {
                log.error("{}: unexpected failure", next.fileName(), e);
                stats = FileStats.failed(next, new FileError(FileError.Kind.IO_FAILURE, e.toString(), 0), Duration.ZERO);
            }
            aggregator.recordFile(stats);
            completed.add(stats);
        }
    }

    FileStats processFile(FileDescriptor file, SinkDispatcher<FinanceRecord> dispatcher) {
        long start = System.nanoTime();
        try (Timer.Context ignored = fileTimer.time()) {
            DelimitedRecordReader reader;
            try {
                reader = DelimitedRecordReader.open(file, detector, config.probeBytes(), config.progressInterval());
            } catch (IOException e) {
                failedCounter.inc();
                log.warn("{}: cannot read file: {}", file.fileName(), e.toString());
                return FileStats.failed(file, new FileError(FileError.Kind.IO_FAILURE, e.toString(), 0), since(start));
            }
            try (reader) {
                return read(file, reader, dispatcher, start);
            }
        }
    }

    private FileStats read(FileDescriptor file, DelimitedRecordReader reader,
                           SinkDispatcher<FinanceRecord> dispatcher, long start) {
        Detection detection = reader.detection();
        log.debug("{}: {} {}{}", file.fileName(), detection.charset().name(), detection.delimiter(),
                detection.lossy() ? " (lossy)" : "");
        List<String> missing = missingColumns(file.recordType(), reader.header());
        if (!missing.isEmpty()) {
            log.warn("{}: header lacks required columns {}", file.fileName(), missing);
        }

        FileStats.Accumulator acc = new FileStats.Accumulator(file);
        FileError error = null;
        while (error == null) {
            if (cancelled.get()) {
                error = new FileError(FileError.Kind.CANCELLED, "run cancelled after " + acc.rows() + " rows", acc.rows());
                break;
            }
            Optional<Record<FinanceRecord>> next = reader.poll();
            if (next.isEmpty()) break;
            Record<FinanceRecord> record = next.get();
            ValidationResult result = validator.validate(record.payload());
            acc.add(result);
            rowsMeter.mark();
            if (!result.valid()) {
                invalidMeter.mark();
                continue;
            }
            validMeter.mark();
            error = handOff(file, record, dispatcher);
        }
        if (error == null && reader.isTruncated()) {
            error = new FileError(FileError.Kind.DECODE_TRUNCATED, reader.truncationReason().orElse("truncated"),
                    reader.truncatedAtRow().orElse(acc.rows()));
        }

        boolean drift = !missing.isEmpty() || driftByRows(acc);
        if (drift && missing.isEmpty()) {
            log.warn("{}: {} of {} rows miss required fields, schema drift suspected", file.fileName(),
                    acc.rejected(Rejection.MISSING_FIELD), acc.rows());
        }
        FileStats stats = acc.build(since(start), detection, missing, drift, Optional.ofNullable(error));
        if (error != null && error.kind() != FileError.Kind.SINK_TIMEOUT) {
            log.warn("{}: {} at row {}: {}", file.fileName(), error.kind(), error.atRow(), error.message());
        }
        log.info("{}: {} rows ({} valid, {} invalid) in {} ms", file.fileName(), stats.rowsProcessed(), stats.valid(),
                stats.invalid(), stats.elapsed().toMillis());
        return stats;
    }

    private FileError handOff(FileDescriptor file, Record<FinanceRecord> record, SinkDispatcher<FinanceRecord> dispatcher) {
        try {
            if (dispatcher.offer(record, config.sinkTimeoutMillis(), TimeUnit.MILLISECONDS)) return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return new FileError(FileError.Kind.CANCELLED, "interrupted handing off row " + record.seq(), record.seq());
        }
        log.error("{}: sink accepted nothing for {} ms at row {}; cancelling run", file.fileName(),
                config.sinkTimeoutMillis(), record.seq());
        cancel();
        return new FileError(FileError.Kind.SINK_TIMEOUT,
                "sink blocked for more than " + config.sinkTimeoutMillis() + " ms", record.seq());
    }

    private boolean driftByRows(FileStats.Accumulator acc) {
        long rows = acc.rows();
        if (rows == 0 || rows < config.schemaDriftMinRows()) return false;
        return (double) acc.rejected(Rejection.MISSING_FIELD) / rows >= config.schemaDriftThreshold();
    }

    static List<String> missingColumns(RecordType type, List<String> header) {
        if (header.isEmpty()) return List.of();
        List<String> missing = new ArrayList<>();
        for (String column : type.requiredColumns()) {
            if (!header.contains(column)) missing.add(column);
        }
        return missing;
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
