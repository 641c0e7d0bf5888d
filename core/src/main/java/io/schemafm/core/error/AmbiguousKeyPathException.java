package io.schemafm.core.error;

/**
 * Two key mapping entries can match the same concrete key. Raised at table load time, and at
 * lookup time should an ambiguity slip through; the table never picks a winner.
 */
public final class AmbiguousKeyPathException extends MappingException {

    private static final long serialVersionUID = 1L;

    private final String conflictingPath;

    public AmbiguousKeyPathException(String keyPath, String conflictingPath) {
        super(
                keyPath.equals(conflictingPath)
                        ? "Duplicate key path '" + keyPath + "'"
                        : "Key path '" + keyPath + "' overlaps '" + conflictingPath + "'",
                keyPath);
        this.conflictingPath = conflictingPath;
    }

    /** The already-registered pattern that collides with {@link #keyPath()}. */
    public String conflictingPath() {
        return conflictingPath;
    }
}
