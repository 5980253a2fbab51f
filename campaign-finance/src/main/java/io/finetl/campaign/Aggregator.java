package io.finetl.campaign;

/**
 * The single owner of the run's {@link AggregateStats}. Workers hand in completed files; each merge is atomic.
 */
public class Aggregator {
    private AggregateStats stats = AggregateStats.empty();

    public synchronized void recordFile(FileStats fileStats) {
        stats = stats.merge(fileStats);
    }

    public synchronized AggregateStats snapshot() {
        return stats;
    }
}
