package io.schemafm.core.error;

/** A persisted model file does not follow the model grammar. */
public final class ModelParseException extends InputException {

    private static final long serialVersionUID = 1L;

    private final int line;

    public ModelParseException(String message, String source, int line) {
        super(line > 0 ? message + " (line " + line + ")" : message, source);
        this.line = line;
    }

    public ModelParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
        this.line = -1;
    }

    /** 1-based line number of the offending text, or {@code -1} when unknown. */
    public int line() {
        return line;
    }
}
