package io.finetl.campaign;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Files of one input directory grouped by record type, plus the files that matched no type.
 */
public record Classification(Map<RecordType, List<FileDescriptor>> byType, List<Path> skipped) {
    public Classification {
        EnumMap<RecordType, List<FileDescriptor>> copy = new EnumMap<>(RecordType.class);
        for (RecordType t : RecordType.values()) {
            copy.put(t, List.copyOf(byType.getOrDefault(t, List.of())));
        }
        byType = Collections.unmodifiableMap(copy);
        skipped = List.copyOf(skipped);
    }

    public List<FileDescriptor> files(RecordType type) {
        return byType.get(type);
    }

    /** Every classified file, in processing order: type declaration order, then path. */
    public List<FileDescriptor> all() {
        List<FileDescriptor> out = new ArrayList<>();
        for (List<FileDescriptor> files : byType.values()) out.addAll(files);
        return out;
    }

    public int classifiedCount() {
        return byType.values().stream().mapToInt(List::size).sum();
    }
}
