package io.finetl.campaign;

import io.finetl.core.Record;
import io.finetl.core.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Streams the data rows of one delimited file as {@link FinanceRecord}s, one row per {@link #poll()}.
 * <p>
 * The first line is the header. Only the header and the current line are held in memory. A row is zipped against the
 * header up to the shorter of the two, so short rows simply lack the trailing fields. A line that cannot be decoded
 * ends the stream there; rows already returned stay valid and the truncation is reported by
 * {@link #truncatedAtRow()}.
 */
public class DelimitedRecordReader implements Source<FinanceRecord> {
    private static final Logger log = LoggerFactory.getLogger(DelimitedRecordReader.class);

    private final FileDescriptor file;
    private final Detection detection;
    private final ByteLineReader lines;
    private final CharsetDecoder decoder;
    private final CellSplitter splitter;
    private final int progressInterval;
    private final List<String> header;

    private long rowsRead = 0;
    private boolean finished = false;
    private long truncatedAtRow = -1;
    private String truncationReason;

    /**
     * Open {@code file}, detect its encoding and delimiter from the first {@code probeBytes} bytes, and read its
     * header.
     *
     * @throws IOException if the file cannot be opened or read at all
     */
    public static DelimitedRecordReader open(FileDescriptor file, EncodingDetector detector, int probeBytes,
                                             int progressInterval) throws IOException {
        InputStream raw = Files.newInputStream(file.path());
        try {
            byte[] head = raw.readNBytes(Math.max(1, probeBytes));
            Detection detection = detector.detect(head);
            InputStream replay = new SequenceInputStream(new ByteArrayInputStream(head), raw);
            return new DelimitedRecordReader(file, detection, replay, progressInterval);
        } catch (IOException | RuntimeException e) {
            try {
                raw.close();
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }

    DelimitedRecordReader(FileDescriptor file, Detection detection, InputStream in, int progressInterval) throws IOException {
        this.file = file;
        this.detection = detection;
        this.lines = new ByteLineReader(in);
        CodingErrorAction onError = detection.lossy() ? CodingErrorAction.REPLACE : CodingErrorAction.REPORT;
        this.decoder = detection.charset().newDecoder()
                .onMalformedInput(onError)
                .onUnmappableCharacter(onError);
        this.splitter = new CellSplitter(detection.delimiter());
        this.progressInterval = Math.max(0, progressInterval);
        this.header = readHeader();
    }

    private List<String> readHeader() throws IOException {
        byte[] raw = lines.readLine();
        if (raw == null) {
            finish();
            return List.of();
        }
        String line;
        try {
            line = decoder.decode(ByteBuffer.wrap(raw)).toString();
        } catch (CharacterCodingException e) {
            truncate(0, "header is not valid " + detection.charset().name());
            return List.of();
        }
        if (line.startsWith("\uFEFF")) line = line.substring(1);
        List<String> names = new ArrayList<>();
        for (String cell : splitter.split(line)) names.add(cell.strip());
        return Collections.unmodifiableList(names);
    }

    @Override
    public Optional<Record<FinanceRecord>> poll() {
        if (finished) return Optional.empty();
        try {
            while (true) {
                byte[] raw = lines.readLine();
                if (raw == null) {
                    finish();
                    return Optional.empty();
                }
                String line;
                try {
                    line = decoder.decode(ByteBuffer.wrap(raw)).toString();
                } catch (CharacterCodingException e) {
                    truncate(rowsRead + 1, "undecodable " + detection.charset().name() + " bytes in row " + (rowsRead + 1));
                    return Optional.empty();
                }
                if (line.isBlank()) continue;
                rowsRead++;
                if (progressInterval > 0 && rowsRead % progressInterval == 0) {
                    log.debug("{}: {} rows read", file.fileName(), rowsRead);
                }
                FinanceRecord rec = new FinanceRecord(file.recordType(), file.fileName(), rowsRead, zip(splitter.split(line)));
                return Optional.of(Record.of(rowsRead, rec));
            }
        } catch (IOException e) {
            truncate(rowsRead + 1, "read failed in row " + (rowsRead + 1) + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private Map<String, String> zip(String[] cells) {
        int n = Math.min(header.size(), cells.length);
        Map<String, String> fields = new LinkedHashMap<>(n * 2);
        for (int i = 0; i < n; i++) {
            fields.putIfAbsent(header.get(i), cells[i]);
        }
        return fields;
    }

    private void truncate(long atRow, String reason) {
        truncatedAtRow = atRow;
        truncationReason = reason;
        log.warn("{}: stream truncated: {}", file.fileName(), reason);
        finish();
    }

    private void finish() {
        finished = true;
        close();
    }

    @Override
    public boolean isFinished() {
        return finished;
    }

    public Detection detection() { return detection; }
    public List<String> header() { return header; }
    public long rowsRead() { return rowsRead; }

    public boolean isTruncated() { return truncatedAtRow >= 0; }

    /** Data row (1-based; 0 for the header) at which the stream was cut short. */
    public OptionalLong truncatedAtRow() {
        return isTruncated() ? OptionalLong.of(truncatedAtRow) : OptionalLong.empty();
    }

    public Optional<String> truncationReason() {
        return Optional.ofNullable(truncationReason);
    }

    @Override
    public void close() {
        try {
            lines.close();
        } catch (IOException e) {
            log.debug("{}: close failed: {}", file.fileName(), e.toString());
        }
    }
}
