package io.schemafm.core.synth;

import java.util.Set;

/** Turns schema names into feature id segments. */
public final class FeatureNames {

    /** Prefix applied to segments that would clash with model keywords or synthetic names. */
    public static final String ESCAPE_PREFIX = "_";

    public static final String IS_EMPTY = "isEmpty";
    public static final String IS_NULL = "isNull";
    public static final String ONE_OF = "oneOf";
    public static final String ANY_OF = "anyOf";

    private static final Set<String> RESERVED = Set.of(
            "namespace",
            "features",
            "constraints",
            "aliases",
            "mandatory",
            "optional",
            "alternative",
            "or",
            "String",
            "Integer",
            "Real",
            "Boolean",
            "true",
            "false",
            IS_EMPTY,
            IS_NULL,
            ONE_OF,
            ANY_OF);

    private FeatureNames() {
        // utility class
    }

    /**
     * Sanitizes a name into a single id segment: characters outside {@code [A-Za-z0-9_]} become
     * {@code _}, and names that are reserved or start with a digit get {@link #ESCAPE_PREFIX}.
     */
    public static String segment(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            sb.append(isSegmentChar(c) ? c : '_');
        }
        String s = sb.toString();
        if (s.isEmpty() || Character.isDigit(s.charAt(0)) || isReserved(s)) {
            s = ESCAPE_PREFIX + s;
        }
        return s;
    }

    public static boolean isReserved(String segment) {
        return RESERVED.contains(segment);
    }

    static boolean isSegmentChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }
}
