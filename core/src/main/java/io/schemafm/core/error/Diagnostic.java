package io.schemafm.core.error;

import java.util.Objects;

/**
 * One recorded recoverable condition: an unresolved reference, an unsupported construct, an alias,
 * a model inconsistency and so on. Diagnostics are never discarded; they are enumerated in the run
 * summary.
 *
 * @param severity how serious the condition is
 * @param code     stable machine-readable code, see {@link Diagnostics} constants
 * @param subject  the definition, feature id or key path concerned
 * @param message  human-readable description
 */
public record Diagnostic(Severity severity, String code, String subject, String message) {

    public enum Severity {
        INFO,
        WARNING
    }

    public Diagnostic {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static Diagnostic warning(String code, String subject, String message) {
        return new Diagnostic(Severity.WARNING, code, subject, message);
    }

    public static Diagnostic info(String code, String subject, String message) {
        return new Diagnostic(Severity.INFO, code, subject, message);
    }

    /** Converts a recoverable schema exception into its warning entry. */
    public static Diagnostic of(SchemaException e) {
        String code = e instanceof UnresolvedReferenceException
                ? Diagnostics.UNRESOLVED_REFERENCE
                : Diagnostics.UNSUPPORTED_CONSTRUCT;
        return warning(code, e.definition(), e.detail());
    }

    @Override
    public String toString() {
        return severity + " [" + code + "] " + subject + ": " + message;
    }
}
