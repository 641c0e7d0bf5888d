package io.schemafm.core.error;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe accumulator of {@link Diagnostic}s for one build or one run. Warnings are logged
 * when recorded.
 */
public final class Diagnostics {

    private static final Logger LOG = LoggerFactory.getLogger(Diagnostics.class);

    public static final String UNRESOLVED_REFERENCE = "unresolved-reference";
    public static final String UNSUPPORTED_CONSTRUCT = "unsupported-construct";
    public static final String ALIAS = "alias";
    public static final String MODEL_INCONSISTENCY = "model-inconsistency";
    public static final String DANGLING_CONSTRAINT = "dangling-constraint";
    public static final String UNCONVERTED_DESCRIPTION = "unconverted-description";
    public static final String KIND_COLLISION = "kind-collision";
    public static final String NAME_COLLISION = "name-collision";

    private final List<Diagnostic> entries = new ArrayList<>();

    public synchronized void add(Diagnostic diagnostic) {
        entries.add(diagnostic);
        if (diagnostic.severity() == Diagnostic.Severity.WARNING) {
            LOG.warn("{}", diagnostic);
        } else {
            LOG.debug("{}", diagnostic);
        }
    }

    public void warn(String code, String subject, String message) {
        add(Diagnostic.warning(code, subject, message));
    }

    public void info(String code, String subject, String message) {
        add(Diagnostic.info(code, subject, message));
    }

    public synchronized void addAll(Collection<Diagnostic> diagnostics) {
        entries.addAll(diagnostics);
    }

    /** Snapshot of every entry, in recording order. */
    public synchronized List<Diagnostic> all() {
        return List.copyOf(entries);
    }

    public synchronized List<Diagnostic> withCode(String code) {
        return entries.stream().filter(d -> d.code().equals(code)).toList();
    }

    /** Entry count per code, sorted by code. */
    public synchronized Map<String, Integer> countsByCode() {
        Map<String, Integer> counts = new TreeMap<>();
        for (Diagnostic d : entries) {
            counts.merge(d.code(), 1, Integer::sum);
        }
        return counts;
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public synchronized int size() {
        return entries.size();
    }
}
