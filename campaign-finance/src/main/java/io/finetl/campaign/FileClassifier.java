package io.finetl.campaign;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Groups the files of a directory by record type using the publisher's file naming convention.
 * Deterministic order: path-sorted within each type.
 */
public class FileClassifier {
    public static final Set<String> DEFAULT_EXTENSIONS = Set.of("csv", "txt");

    private final Set<String> extensions;

    public FileClassifier() {
        this(DEFAULT_EXTENSIONS);
    }

    /**
     * @param extensions accepted file extensions, without the dot; empty accepts every regular file
     */
    public FileClassifier(Set<String> extensions) {
        this.extensions = extensions.stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * @throws IOException if {@code dir} is not a directory or cannot be listed
     */
    public Classification classify(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) throw new NotDirectoryException(dir.toString());
        List<Path> files;
        try (Stream<Path> stream = Files.list(dir)) {
            files = stream.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(Path::toString))
                    .toList();
        }

        EnumMap<RecordType, List<FileDescriptor>> byType = new EnumMap<>(RecordType.class);
        List<Path> skipped = new ArrayList<>();
        for (Path p : files) {
            String name = p.getFileName().toString();
            Optional<RecordType> type = hasAcceptedExtension(name) ? RecordType.forFileName(name) : Optional.empty();
            if (type.isEmpty()) {
                skipped.add(p);
                continue;
            }
            byType.computeIfAbsent(type.get(), t -> new ArrayList<>())
                    .add(new FileDescriptor(p, type.get(), sizeOf(p)));
        }
        return new Classification(byType, skipped);
    }

    private boolean hasAcceptedExtension(String name) {
        if (extensions.isEmpty()) return true;
        int dot = name.lastIndexOf('.');
        return dot >= 0 && extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    // size is informational; an unreadable file fails later, when it is opened
    private static long sizeOf(Path p) {
        try {
            return Files.size(p);
        } catch (IOException e) {
            return -1L;
        }
    }
}
