package io.finetl.campaign;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One data row of a finance file. Field names are the file's own header tokens, in header order.
 */
public record FinanceRecord(RecordType recordType, String sourceFile, long rowNumber, Map<String, String> fields) {
    public FinanceRecord {
        Objects.requireNonNull(recordType, "recordType");
        Objects.requireNonNull(sourceFile, "sourceFile");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
