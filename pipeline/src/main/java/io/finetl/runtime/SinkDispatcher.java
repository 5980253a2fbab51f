package io.finetl.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.finetl.core.BatchSink;
import io.finetl.core.Record;
import io.finetl.core.Sink;
import io.finetl.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands records from any number of producer threads to a single sink thread through a bounded queue.
 * <p>
 * Producers call {@link #offer(Record, long, TimeUnit)}; a producer that cannot enqueue within its timeout gets
 * {@code false} back and decides what a stalled sink means for it. The sink thread groups records into batches of
 * {@code batchSize} when the sink is a {@link BatchSink}, and flushes a partial batch after {@code flushEveryMillis}
 * of inactivity. Records from one producer reach the sink in the order that producer offered them.
 */
public class SinkDispatcher<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SinkDispatcher.class);

    private final Sink<T> sink;
    private final ArrayBlockingQueue<Item<T>> queue;
    private final int batchSize;
    private final long flushEveryMillis;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private volatile Thread sinkThread;

    private final Timer flushTimer;
    private final Meter outMeter;
    private final Meter errorMeter;

    public SinkDispatcher(Sink<T> sink, int queueCapacity, int batchSize, long flushEveryMillis, Metrics metrics) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        this.batchSize = Math.max(1, batchSize);
        this.flushEveryMillis = Math.max(0, flushEveryMillis);
        Objects.requireNonNull(metrics, "metrics");
        this.flushTimer = metrics.timer("sink.dispatch.flush.time");
        this.outMeter = metrics.meter("sink.dispatch.output.rate");
        this.errorMeter = metrics.meter("sink.dispatch.error.rate");
    }

    public void start() {
        if (!started.compareAndSet(false, true)) return;
        sinkThread = new Thread(this::runSink, "sink-dispatcher");
        sinkThread.setDaemon(true);
        sinkThread.start();
    }

    /**
     * Enqueue a record for the sink.
     *
     * @return false if the queue stayed full for the whole timeout
     */
    public boolean offer(Record<T> record, long timeout, TimeUnit unit) throws InterruptedException {
        Objects.requireNonNull(record, "record");
        if (!started.get()) throw new IllegalStateException("dispatcher not started");
        return queue.offer(Item.of(record), timeout, unit);
    }

    public long delivered() { return delivered.get(); }
    public long failures() { return failures.get(); }

    /**
     * Signal end of input and wait for the sink thread to drain what is queued.
     * A sink that does not drain within the timeout is interrupted and the remaining records are dropped.
     *
     * @return true if every queued record was handed to the sink
     */
    public boolean finish(long timeoutMillis) {
        Thread t = sinkThread;
        if (t == null) return true;
        boolean drained = false;
        try {
            boolean queued = queue.offer(Item.poison(), timeoutMillis, TimeUnit.MILLISECONDS);
            if (queued) {
                t.join(Math.max(1, timeoutMillis));
                drained = !t.isAlive();
            }
            if (t.isAlive()) {
                log.warn("sink did not drain within {} ms; interrupting with {} records queued", timeoutMillis, queue.size());
                t.interrupt();
                t.join(Math.max(1, timeoutMillis));
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            t.interrupt();
        }
        if (!drained) dropQueued();
        return drained;
    }

    // Records left behind by an interrupted sink thread count as failures, so delivered + failures == offered.
    private void dropQueued() {
        List<Item<T>> rest = new ArrayList<>();
        queue.drainTo(rest);
        int dropped = 0;
        for (Item<T> item : rest) {
            if (!item.isPoison()) dropped++;
        }
        if (dropped > 0) {
            failed(dropped, null);
            log.warn("dropped {} queued records that never reached the sink", dropped);
        }
    }

    private void runSink() {
        List<Record<T>> emitBuffer = new ArrayList<>();
        try {
            while (!Thread.currentThread().isInterrupted()) {
                Item<T> item = flushEveryMillis > 0
                        ? queue.poll(flushEveryMillis, TimeUnit.MILLISECONDS)
                        : queue.take();
                if (item == null) {
                    flush(emitBuffer);
                    continue;
                }
                if (item.isPoison()) {
                    flush(emitBuffer);
                    return;
                }
                emitBuffer.add(item.record);
                if (emitBuffer.size() >= batchSize) flush(emitBuffer);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!emitBuffer.isEmpty()) {
            log.warn("sink thread interrupted; dropping {} buffered records", emitBuffer.size());
            failed(emitBuffer.size(), null);
            emitBuffer.clear();
        }
    }

    private void flush(List<Record<T>> records) {
        if (records.isEmpty()) return;
        try (Timer.Context ignored = flushTimer.time()) {
            if (sink instanceof BatchSink<T> bs) {
                deliver(records, () -> bs.acceptBatch(records));
            } else {
                for (Record<T> r : records) {
                    if (Thread.currentThread().isInterrupted()) {
                        failed(1, null);
                        continue;
                    }
                    deliver(List.of(r), () -> sink.accept(r));
                }
            }
        } finally {
            records.clear();
        }
    }

    private void deliver(List<Record<T>> records, SinkCall call) {
        try {
            call.run();
            delivered.addAndGet(records.size());
            outMeter.mark(records.size());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            failed(records.size(), null);
        } catch (Exception e) {
            failed(records.size(), e);
        }
    }

    private void failed(int count, Exception cause) {
        failures.addAndGet(count);
        errorMeter.mark(count);
        if (cause != null) log.warn("sink rejected {} record(s): {}", count, cause.toString());
    }

    @FunctionalInterface
    private interface SinkCall {
        void run() throws Exception;
    }

    @Override
    public void close() {
        finish(5000);
    }

    static final class Item<T> {
        final Record<T> record;
        private final boolean poison;

        private Item(Record<T> record, boolean poison) {
            this.record = record; this.poison = poison;
        }
        static <T> Item<T> of(Record<T> record) { return new Item<>(record, false); }
        static <T> Item<T> poison() { return new Item<>(null, true); }
        boolean isPoison() { return poison; }
    }
}
