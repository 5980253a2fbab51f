package io.finetl.campaign;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Counters for one processed file. {@code valid + invalid == rowsProcessed} always holds.
 *
 * @param validByGeographicUnit valid records per state code; its key set is the distinct units seen
 * @param missingColumns        required columns absent from the file's header
 */
public record FileStats(Path path,
                        RecordType recordType,
                        long sizeBytes,
                        long rowsProcessed,
                        long valid,
                        long invalid,
                        Map<String, Long> validByGeographicUnit,
                        Map<Rejection, Long> rejections,
                        BigDecimal validAmount,
                        Duration elapsed,
                        Optional<Detection> detection,
                        List<String> missingColumns,
                        boolean schemaDriftSuspected,
                        Optional<FileError> error) {
    public FileStats {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(recordType, "recordType");
        if (valid < 0 || invalid < 0 || valid + invalid != rowsProcessed) {
            throw new IllegalArgumentException("valid(" + valid + ") + invalid(" + invalid + ") != rows(" + rowsProcessed + ")");
        }
        validByGeographicUnit = Collections.unmodifiableMap(new TreeMap<>(validByGeographicUnit));
        EnumMap<Rejection, Long> r = new EnumMap<>(Rejection.class);
        r.putAll(rejections);
        rejections = Collections.unmodifiableMap(r);
        missingColumns = List.copyOf(missingColumns);
        Objects.requireNonNull(validAmount, "validAmount");
        Objects.requireNonNull(elapsed, "elapsed");
        Objects.requireNonNull(detection, "detection");
        Objects.requireNonNull(error, "error");
    }

    public String fileName() {
        return path.getFileName().toString();
    }

    public Set<String> geographicUnits() {
        return validByGeographicUnit.keySet();
    }

    /** A file that could not be read at all. */
    static FileStats failed(FileDescriptor file, FileError error, Duration elapsed) {
        return new FileStats(file.path(), file.recordType(), file.sizeBytes(), 0, 0, 0, Map.of(), Map.of(),
                BigDecimal.ZERO, elapsed, Optional.empty(), List.of(), false, Optional.of(error));
    }

    /**
     * Mutable per-file counters, owned by the worker reading the file. Each row lands in exactly one of valid/invalid.
     */
    static final class Accumulator {
        private final FileDescriptor file;
        private long valid;
        private long invalid;
        private BigDecimal validAmount = BigDecimal.ZERO;
        private final Map<String, Long> units = new TreeMap<>();
        private final EnumMap<Rejection, Long> rejections = new EnumMap<>(Rejection.class);

        Accumulator(FileDescriptor file) {
            this.file = file;
        }

        void add(ValidationResult result) {
            if (result.valid()) {
                valid++;
                validAmount = validAmount.add(result.normalizedAmount().orElse(BigDecimal.ZERO));
                result.geographicUnit().ifPresent(u -> units.merge(u, 1L, Long::sum));
            } else {
                invalid++;
                rejections.merge(result.rejection(), 1L, Long::sum);
            }
        }

        long rows() { return valid + invalid; }

        long rejected(Rejection why) { return rejections.getOrDefault(why, 0L); }

        FileStats build(Duration elapsed, Detection detection, List<String> missingColumns, boolean drift,
                        Optional<FileError> error) {
            return new FileStats(file.path(), file.recordType(), file.sizeBytes(), rows(), valid, invalid, units,
                    rejections, validAmount, elapsed, Optional.ofNullable(detection), missingColumns, drift, error);
        }
    }
}
