package io.schemafm.core.error;

/** Translating a document exceeded its time or nesting-depth budget. */
public final class TranslationBudgetExceededException extends InputException {

    private static final long serialVersionUID = 1L;

    public TranslationBudgetExceededException(String message, String source) {
        super(message, source);
    }
}
