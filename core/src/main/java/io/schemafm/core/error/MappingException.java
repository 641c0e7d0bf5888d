package io.schemafm.core.error;

/** Abstract parent for key-mapping errors. Carries the offending configuration key path. */
public abstract class MappingException extends FeatureModelException {

    private static final long serialVersionUID = 1L;

    private final String keyPath;

    protected MappingException(String message, String keyPath) {
        super(message, Category.MAPPING);
        this.keyPath = keyPath;
    }

    public String keyPath() {
        return keyPath;
    }
}
