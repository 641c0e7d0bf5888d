package io.schemafm.batch.runner;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists corpus files by extension in a stable order, so batch ids mean the same files across
 * restarts.
 */
public final class CorpusScanner {

    private final Path root;
    private final Set<String> extensions;

    public CorpusScanner(Path root, List<String> extensions) {
        this.root = root;
        this.extensions = extensions.stream()
                .map(e -> e.startsWith(".") ? e.substring(1) : e)
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    public Path root() {
        return root;
    }

    /** Matching regular files under the root, sorted by relative path. */
    public List<Path> scan() {
        if (!Files.isDirectory(root)) {
            throw new UncheckedIOException("Corpus directory not found: " + root, new NoSuchFileException(root.toString()));
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .filter(this::matches)
                    .sorted((a, b) -> relative(a).compareTo(relative(b)))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan corpus " + root, e);
        }
    }

    /** Path relative to the root with forward slashes. */
    public String relative(Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private boolean matches(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
