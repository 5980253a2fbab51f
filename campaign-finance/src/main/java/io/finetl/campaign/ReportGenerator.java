package io.finetl.campaign;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives the report figures from a finished (or cancelled) run and renders them as text. Pure; holds only the
 * reporting thresholds.
 */
public class ReportGenerator {
    private final int topN;
    private final int expectedSubdivisions;
    private final double coverageThreshold;
    private final long volumeThreshold;

    public ReportGenerator(int topN, int expectedSubdivisions, double coverageThreshold, long volumeThreshold) {
        if (topN < 0 || expectedSubdivisions < 0) throw new IllegalArgumentException("topN and subdivisions must be >= 0");
        if (coverageThreshold < 0 || coverageThreshold > 1) throw new IllegalArgumentException("coverage threshold must be in [0,1]");
        if (volumeThreshold < 0) throw new IllegalArgumentException("volume threshold must be >= 0");
        this.topN = topN;
        this.expectedSubdivisions = expectedSubdivisions;
        this.coverageThreshold = coverageThreshold;
        this.volumeThreshold = volumeThreshold;
    }

    public ProcessingReport generate(AggregateStats stats, List<FileStats> files, List<Path> skipped,
                                     Duration wallTime, boolean cancelled, long sinkFailures) {
        List<FileStats> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparing(FileStats::path));
        return new ProcessingReport(stats, sorted, skipped, cancelled, wallTime, sinkFailures,
                percentages(stats), topUnits(stats), throughput(stats.totalRecords(), wallTime), coverage(stats),
                new ProcessingReport.Volume(stats.totalRecords(), volumeThreshold, stats.totalRecords() >= volumeThreshold));
    }

    private static Map<RecordType, Double> percentages(AggregateStats stats) {
        Map<RecordType, Double> out = new EnumMap<>(RecordType.class);
        long total = stats.totalRecords();
        for (RecordType t : RecordType.values()) {
            out.put(t, total == 0 ? 0.0 : 100.0 * stats.records(t) / total);
        }
        return out;
    }

    private List<ProcessingReport.UnitCount> topUnits(AggregateStats stats) {
        long total = stats.totalRecords();
        return stats.recordsByGeographicUnit().entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry::getKey))
                .limit(topN)
                .map(e -> new ProcessingReport.UnitCount(e.getKey(), e.getValue(),
                        total == 0 ? 0.0 : 100.0 * e.getValue() / total))
                .toList();
    }

    static double throughput(long records, Duration wallTime) {
        long nanos = wallTime.toNanos();
        return nanos <= 0 ? 0.0 : records / (nanos / 1_000_000_000.0);
    }

    private ProcessingReport.Coverage coverage(AggregateStats stats) {
        int expected = RecordType.values().length * expectedSubdivisions;
        double ratio = expected == 0 ? 1.0 : (double) stats.filesProcessed() / expected;
        boolean complete = stats.filesProcessed() >= coverageThreshold * expected;
        return new ProcessingReport.Coverage(expected, stats.filesProcessed(), ratio, coverageThreshold, complete);
    }

    public String render(ProcessingReport report) {
        AggregateStats s = report.stats();
        StringBuilder sb = new StringBuilder();
        sb.append(report.cancelled() ? "Bulk processing report (CANCELLED, partial)\n" : "Bulk processing report\n");
        line(sb, "  files processed: %d (with errors: %d, unreadable: %d, skipped: %d)",
                s.filesProcessed(), s.filesWithErrors(), s.filesFailed(), report.skippedCount());
        line(sb, "  records: %d (valid: %d, invalid: %d)", s.totalRecords(), s.validRecords(), s.invalidRecords());
        line(sb, "  wall time: %.3f s, throughput: %.1f records/s", report.wallTime().toMillis() / 1000.0, report.recordsPerSecond());
        if (report.sinkFailures() > 0) line(sb, "  sink failures: %d", report.sinkFailures());

        sb.append("  by type:\n");
        for (RecordType t : RecordType.values()) {
            line(sb, "    %-20s files=%d records=%d (%.2f%%) valid=%d amount=%s", t.label(), s.files(t), s.records(t),
                    report.percentageByType().getOrDefault(t, 0.0), s.valid(t),
                    s.validAmountByType().getOrDefault(t, BigDecimal.ZERO).toPlainString());
        }

        if (!report.topGeographicUnits().isEmpty()) {
            line(sb, "  top %d geographic units:", report.topGeographicUnits().size());
            for (ProcessingReport.UnitCount u : report.topGeographicUnits()) {
                line(sb, "    %-4s %d (%.1f%%)", u.unit(), u.records(), u.percentage());
            }
        }

        ProcessingReport.Coverage c = report.coverage();
        line(sb, "  coverage: %d/%d files (%.1f%%) %s", c.filesProcessed(), c.expectedFiles(), c.ratio() * 100,
                c.complete() ? "complete" : "INCOMPLETE, below " + Math.round(c.threshold() * 100) + "%");
        ProcessingReport.Volume v = report.volume();
        line(sb, "  volume: %d records, %s (threshold %d)", v.records(),
                v.productionScale() ? "production scale" : "LIMITED", v.threshold());

        for (FileStats f : report.filesWithErrors()) {
            FileError e = f.error().orElseThrow();
            line(sb, "  error %s: %s at row %d: %s", f.fileName(), e.kind(), e.atRow(), e.message());
        }
        for (FileStats f : report.schemaDriftFiles()) {
            line(sb, "  schema drift %s: missing columns %s, %d of %d rows missing fields", f.fileName(),
                    f.missingColumns(), f.rejections().getOrDefault(Rejection.MISSING_FIELD, 0L), f.rowsProcessed());
        }
        return sb.toString();
    }

    private static void line(StringBuilder sb, String format, Object... args) {
        sb.append(String.format(Locale.ROOT, format, args)).append('\n');
    }
}
