package io.finetl.core;

import java.io.Closeable;
import java.util.Optional;

/**
 * A Source produces records lazily, one per {@link #poll()}, in the order they appear in the underlying input.
 * Sources are forward-only; reading again means opening a new one.
 */
public interface Source<T> extends Closeable {
    /**
     * Fetch the next record if any. Finite sources return empty once exhausted and report it through
     * {@link #isFinished()}.
     */
    Optional<Record<T>> poll();

    /**
     * Whether the source has reached a terminal state and will produce no more records.
     */
    boolean isFinished();

    @Override
    default void close() {}
}
