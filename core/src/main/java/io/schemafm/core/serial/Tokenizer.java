package io.schemafm.core.serial;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one line into words (ids, keywords, numbers), quoted strings and the symbols
 * {@code { } [ ] ( ) , ! & | => <=> ==}.
 */
final class Tokenizer {

    private final String line;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;
    private int next;

    Tokenizer(String line) {
        this.line = line;
        scan();
    }

    Token peek() {
        return tokens.get(next);
    }

    Token take() {
        Token t = tokens.get(next);
        if (t.type() != Token.Type.END) {
            next++;
        }
        return t;
    }

    boolean accept(String symbol) {
        if (peek().is(symbol)) {
            next++;
            return true;
        }
        return false;
    }

    void expect(String symbol) {
        Token t = take();
        if (!t.is(symbol)) {
            throw new IllegalStateException("expected '" + symbol + "' but found " + t);
        }
    }

    String word() {
        Token t = take();
        if (t.type() != Token.Type.WORD) {
            throw new IllegalStateException("expected a name but found " + t);
        }
        return t.text();
    }

    String string() {
        Token t = take();
        if (t.type() != Token.Type.STRING) {
            throw new IllegalStateException("expected a quoted string but found " + t);
        }
        return t.text();
    }

    boolean atEnd() {
        return peek().type() == Token.Type.END;
    }

    private void scan() {
        while (pos < line.length()) {
            char c = line.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '\'') {
                tokens.add(new Token(Token.Type.STRING, readString()));
            } else if (isWordChar(c)) {
                int start = pos;
                while (pos < line.length() && isWordChar(line.charAt(pos))) {
                    pos++;
                }
                tokens.add(new Token(Token.Type.WORD, line.substring(start, pos)));
            } else if (line.startsWith("<=>", pos)) {
                symbol("<=>");
            } else if (line.startsWith("=>", pos)) {
                symbol("=>");
            } else if (line.startsWith("==", pos)) {
                symbol("==");
            } else if ("{}[](),!&|".indexOf(c) >= 0) {
                symbol(String.valueOf(c));
            } else {
                throw new IllegalStateException("unexpected character '" + c + "' at column " + (pos + 1));
            }
        }
        tokens.add(new Token(Token.Type.END, ""));
    }

    private void symbol(String s) {
        tokens.add(new Token(Token.Type.SYMBOL, s));
        pos += s.length();
    }

    private String readString() {
        StringBuilder sb = new StringBuilder();
        pos++;
        while (pos < line.length()) {
            char c = line.charAt(pos++);
            if (c == '\'') {
                return sb.toString();
            }
            if (c == '\\') {
                if (pos >= line.length()) {
                    break;
                }
                char e = line.charAt(pos++);
                switch (e) {
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case '\\', '\'' -> sb.append(e);
                    default -> throw new IllegalStateException("unknown escape '\\" + e + "'");
                }
            } else {
                sb.append(c);
            }
        }
        throw new IllegalStateException("unterminated string");
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-' || c == '+';
    }
}
