package io.finetl.campaign;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one run: the aggregate totals plus per-file detail and the derived figures. A cancelled run produces a
 * report too; its numbers cover the rows read before cancellation.
 *
 * @param files            every classified file that was started, sorted by path
 * @param skipped          files left out because no record type matched their name
 * @param percentageByType share of all rows per record type, 0-100, every type present
 * @param volume           whether the run read enough rows to count as a production-scale load
 */
public record ProcessingReport(AggregateStats stats,
                               List<FileStats> files,
                               List<Path> skipped,
                               boolean cancelled,
                               Duration wallTime,
                               long sinkFailures,
                               Map<RecordType, Double> percentageByType,
                               List<UnitCount> topGeographicUnits,
                               double recordsPerSecond,
                               Coverage coverage,
                               Volume volume) {

    public ProcessingReport {
        files = List.copyOf(files);
        skipped = List.copyOf(skipped);
        percentageByType = Map.copyOf(percentageByType);
        topGeographicUnits = List.copyOf(topGeographicUnits);
    }

    public int skippedCount() {
        return skipped.size();
    }

    public List<FileStats> filesWithErrors() {
        return files.stream().filter(f -> f.error().isPresent()).toList();
    }

    public List<FileStats> schemaDriftFiles() {
        return files.stream().filter(FileStats::schemaDriftSuspected).toList();
    }

    /** @param percentage share of all rows read, 0-100 */
    public record UnitCount(String unit, long records, double percentage) {
    }

    /**
     * @param expectedFiles one file per record type and geographic subdivision
     * @param complete      whether {@code filesProcessed >= threshold * expectedFiles}
     */
    public record Coverage(int expectedFiles, long filesProcessed, double ratio, double threshold, boolean complete) {
    }

    /** {@code productionScale} when {@code records >= threshold}. */
    public record Volume(long records, long threshold, boolean productionScale) {
    }
}
