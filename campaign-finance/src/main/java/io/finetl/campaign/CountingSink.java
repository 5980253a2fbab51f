package io.finetl.campaign;

import io.finetl.core.BatchSink;
import io.finetl.core.Record;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Default downstream: counts delivered records per type and keeps nothing else.
 */
public class CountingSink implements BatchSink<FinanceRecord> {
    private final Map<RecordType, LongAdder> counts = new EnumMap<>(RecordType.class);

    public CountingSink() {
        for (RecordType t : RecordType.values()) counts.put(t, new LongAdder());
    }

    @Override
    public void accept(Record<FinanceRecord> record) {
        counts.get(record.payload().recordType()).increment();
    }

    @Override
    public void acceptBatch(List<Record<FinanceRecord>> records) {
        for (Record<FinanceRecord> r : records) accept(r);
    }

    public long count(RecordType type) {
        return counts.get(type).sum();
    }

    public long total() {
        return counts.values().stream().mapToLong(LongAdder::sum).sum();
    }
}
