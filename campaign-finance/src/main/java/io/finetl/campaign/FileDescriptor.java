package io.finetl.campaign;

import java.nio.file.Path;

/**
 * A classified input file.
 */
public record FileDescriptor(Path path, RecordType recordType, long sizeBytes) {
    public String fileName() {
        return path.getFileName().toString();
    }
}
