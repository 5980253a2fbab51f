package io.finetl.campaign;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

/**
 * Reads raw lines terminated by LF, dropping a trailing CR. Lines are split before decoding so that every line can be
 * decoded on its own; this is safe for the ASCII-compatible encodings the detector can pick.
 */
final class ByteLineReader implements Closeable {
    private final InputStream in;
    private final byte[] chunk = new byte[8192];
    private int pos = 0;
    private int limit = 0;
    private byte[] line = new byte[256];

    ByteLineReader(InputStream in) {
        this.in = in;
    }

    /** Next line without its terminator, or null at end of input. */
    byte[] readLine() throws IOException {
        int len = 0;
        boolean sawAny = false;
        while (true) {
            if (pos >= limit) {
                limit = in.read(chunk, 0, chunk.length);
                pos = 0;
                if (limit <= 0) {
                    limit = 0;
                    if (!sawAny) return null;
                    break;
                }
            }
            sawAny = true;
            byte b = chunk[pos++];
            if (b == '\n') break;
            if (len == line.length) line = Arrays.copyOf(line, len * 2);
            line[len++] = b;
        }
        if (len > 0 && line[len - 1] == '\r') len--;
        return Arrays.copyOf(line, len);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
