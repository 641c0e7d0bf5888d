package io.schemafm.batch.runner;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Append-only record of completed batch ids, one per line. A batch id is appended only after all
 * of its report rows are written, so a restart never skips unreported work.
 */
public final class CheckpointStore {

    private final Path file;
    private final Set<String> completed = new LinkedHashSet<>();

    public CheckpointStore(Path file) {
        this.file = file;
        if (Files.exists(file)) {
            try {
                for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                    if (!line.isBlank()) {
                        completed.add(line.trim());
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read checkpoint " + file, e);
            }
        }
    }

    public synchronized boolean isCompleted(String batchId) {
        return completed.contains(batchId);
    }

    public synchronized boolean isEmpty() {
        return completed.isEmpty();
    }

    public synchronized void markCompleted(String batchId) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, batchId + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to update checkpoint " + file, e);
        }
        completed.add(batchId);
    }

    public synchronized Set<String> completed() {
        return Set.copyOf(completed);
    }
}
