package io.schemafm.core.serial;

/** Lexical token of a model-file line. */
record Token(Type type, String text) {

    enum Type {
        WORD,
        STRING,
        SYMBOL,
        END
    }

    boolean is(String symbol) {
        return type == Type.SYMBOL && text.equals(symbol);
    }

    @Override
    public String toString() {
        return type == Type.END ? "end of line" : "'" + text + "'";
    }
}
