package io.finetl.campaign;

/**
 * A file-level problem. Never fatal to the run.
 *
 * @param atRow data row where processing stopped (1-based), 0 for the header or before any row
 */
public record FileError(Kind kind, String message, long atRow) {
    public enum Kind {
        /** The file could not be opened or read; no rows were processed. */
        IO_FAILURE,
        /** A line could not be decoded; rows before it were processed. */
        DECODE_TRUNCATED,
        /** The run was cancelled while this file was being read. */
        CANCELLED,
        /** The sink stopped taking records. */
        SINK_TIMEOUT
    }
}
