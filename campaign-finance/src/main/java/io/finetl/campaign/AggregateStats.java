package io.finetl.campaign;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Run-wide totals. Immutable; {@link #merge(FileStats)} returns a new value. Merging is commutative and associative,
 * so the result does not depend on the order in which files complete.
 * <p>
 * {@code recordsByType} counts every row (valid or not), so its values always sum to {@code totalRecords};
 * {@code validByType} and {@code recordsByGeographicUnit} count valid rows only.
 */
public record AggregateStats(long filesProcessed,
                             long filesWithErrors,
                             long filesFailed,
                             long totalRecords,
                             long validRecords,
                             long invalidRecords,
                             Map<RecordType, Long> recordsByType,
                             Map<RecordType, Long> validByType,
                             Map<String, Long> recordsByGeographicUnit,
                             Map<RecordType, Long> filesByType,
                             Map<RecordType, BigDecimal> validAmountByType,
                             Duration cumulativeFileTime) {

    public AggregateStats {
        recordsByType = enumCopy(recordsByType);
        validByType = enumCopy(validByType);
        filesByType = enumCopy(filesByType);
        validAmountByType = enumCopy(validAmountByType);
        recordsByGeographicUnit = Collections.unmodifiableMap(new TreeMap<>(recordsByGeographicUnit));
    }

    public static AggregateStats empty() {
        return new AggregateStats(0, 0, 0, 0, 0, 0, Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), Duration.ZERO);
    }

    public AggregateStats merge(FileStats f) {
        RecordType t = f.recordType();
        EnumMap<RecordType, Long> byType = mutable(recordsByType);
        byType.merge(t, f.rowsProcessed(), Long::sum);
        EnumMap<RecordType, Long> valid = mutable(validByType);
        valid.merge(t, f.valid(), Long::sum);
        EnumMap<RecordType, Long> files = mutable(filesByType);
        files.merge(t, 1L, Long::sum);
        EnumMap<RecordType, BigDecimal> amounts = mutable(validAmountByType);
        amounts.merge(t, f.validAmount(), BigDecimal::add);
        TreeMap<String, Long> units = new TreeMap<>(recordsByGeographicUnit);
        f.validByGeographicUnit().forEach((u, n) -> units.merge(u, n, Long::sum));

        boolean hasError = f.error().isPresent();
        boolean ioFailure = hasError && f.error().get().kind() == FileError.Kind.IO_FAILURE;
        return new AggregateStats(
                filesProcessed + 1,
                filesWithErrors + (hasError ? 1 : 0),
                filesFailed + (ioFailure ? 1 : 0),
                totalRecords + f.rowsProcessed(),
                validRecords + f.valid(),
                invalidRecords + f.invalid(),
                byType, valid, units, files, amounts,
                cumulativeFileTime.plus(f.elapsed()));
    }

    public long records(RecordType t) { return recordsByType.getOrDefault(t, 0L); }
    public long valid(RecordType t) { return validByType.getOrDefault(t, 0L); }
    public long files(RecordType t) { return filesByType.getOrDefault(t, 0L); }

    private static <V> Map<RecordType, V> enumCopy(Map<RecordType, V> in) {
        return Collections.unmodifiableMap(mutable(in));
    }

    private static <V> EnumMap<RecordType, V> mutable(Map<RecordType, V> in) {
        EnumMap<RecordType, V> m = new EnumMap<>(RecordType.class);
        m.putAll(in);
        return m;
    }
}
