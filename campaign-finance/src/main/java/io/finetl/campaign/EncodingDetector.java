package io.finetl.campaign;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Picks the text encoding and field delimiter of a file from its first bytes.
 * <p>
 * Encodings are tried in a fixed order: Latin-1 (what the publisher mostly emits), UTF-8, then Windows-1252 with
 * replacement. The first encoding that accepts the whole probe wins; the Windows-1252 fallback accepts anything.
 * The delimiter comes from the first line only.
 */
public class EncodingDetector {
    public static final Charset WINDOWS_1252 = Charset.forName("windows-1252");

    private final List<EncodingProbe> chain;

    public EncodingDetector() {
        this(List.of(new Latin1Probe(), new StrictProbe(StandardCharsets.UTF_8), new LossyProbe(WINDOWS_1252)));
    }

    EncodingDetector(List<EncodingProbe> chain) {
        this.chain = List.copyOf(chain);
    }

    public Detection detect(byte[] head) {
        List<String> rejections = new ArrayList<>();
        for (EncodingProbe probe : chain) {
            Optional<String> rejected = probe.reject(head);
            if (rejected.isEmpty()) {
                return new Detection(probe.charset(), Delimiter.sniff(firstLine(head, probe.charset())), probe.lossy(), rejections);
            }
            rejections.add(probe.charset().name() + ": " + rejected.get());
        }
        // chain exhausted without a lossy step
        return new Detection(WINDOWS_1252, Delimiter.sniff(firstLine(head, WINDOWS_1252)), true, rejections);
    }

    static String firstLine(byte[] head, Charset charset) {
        int end = 0;
        while (end < head.length && head[end] != '\n') end++;
        String line = new String(head, 0, end, charset);
        if (line.endsWith("\r")) line = line.substring(0, line.length() - 1);
        if (line.startsWith("\uFEFF")) line = line.substring(1);
        return line;
    }

    /** One step of the fallback chain. */
    interface EncodingProbe {
        Charset charset();

        /** Empty when the probe bytes decode cleanly, otherwise the reason they do not. */
        Optional<String> reject(byte[] head);

        default boolean lossy() { return false; }
    }

    /**
     * Java decodes any byte as ISO-8859-1, so acceptance is judged on content instead: bytes 0x80-0x9F are C1
     * controls that never show up in Latin-1 text and mean the file is really UTF-8 or Windows-1252.
     */
    static final class Latin1Probe implements EncodingProbe {
        @Override public Charset charset() { return StandardCharsets.ISO_8859_1; }

        @Override
        public Optional<String> reject(byte[] head) {
            if (head.length >= 3 && (head[0] & 0xFF) == 0xEF && (head[1] & 0xFF) == 0xBB && (head[2] & 0xFF) == 0xBF) {
                return Optional.of("starts with a UTF-8 byte order mark");
            }
            for (int i = 0; i < head.length; i++) {
                int b = head[i] & 0xFF;
                if (b >= 0x80 && b <= 0x9F) {
                    return Optional.of(String.format("C1 control byte 0x%02X at offset %d", b, i));
                }
            }
            return Optional.empty();
        }
    }

    static final class StrictProbe implements EncodingProbe {
        private final Charset charset;

        StrictProbe(Charset charset) { this.charset = charset; }

        @Override public Charset charset() { return charset; }

        @Override
        public Optional<String> reject(byte[] head) {
            CharsetDecoder decoder = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
            ByteBuffer in = ByteBuffer.wrap(head);
            CharBuffer out = CharBuffer.allocate(Math.max(16, head.length));
            while (true) {
                // endOfInput=false: a multi-byte sequence cut at the end of the probe is not an error
                CoderResult r = decoder.decode(in, out, false);
                if (r.isOverflow()) { out.clear(); continue; }
                if (r.isError()) {
                    return Optional.of((r.isMalformed() ? "malformed" : "unmappable") + " input at offset " + in.position());
                }
                return Optional.empty();
            }
        }
    }

    static final class LossyProbe implements EncodingProbe {
        private final Charset charset;

        LossyProbe(Charset charset) { this.charset = charset; }

        @Override public Charset charset() { return charset; }
        @Override public Optional<String> reject(byte[] head) { return Optional.empty(); }
        @Override public boolean lossy() { return true; }
    }
}
