package io.schemafm.core.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Kind-qualified path of keys through a document, e.g. {@code Pod.spec.containers[*].name}.
 *
 * <p>
 * Concrete paths (from documents) contain names and indices; patterns (from the mapping table)
 * may also contain {@code [*]} for any array index and {@code *} for any map key. A key
 * containing {@code .}, {@code [}, {@code ]} or {@code "}, or a literal {@code *}, is written
 * quoted: {@code labels["app.kubernetes.io/name"]}.
 */
public final class KeyPath {

    /** One step of a path. */
    public sealed interface Segment permits Name, Index, AnyName, AnyIndex {}

    public record Name(String name) implements Segment {
        public Name {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    public record Index(int index) implements Segment {}

    /** Any key of a map. */
    public record AnyName() implements Segment {}

    /** Any element of an array. */
    public record AnyIndex() implements Segment {}

    public static final AnyName ANY_NAME = new AnyName();
    public static final AnyIndex ANY_INDEX = new AnyIndex();

    private final List<Segment> segments;

    private KeyPath(List<Segment> segments) {
        this.segments = Collections.unmodifiableList(segments);
    }

    public static KeyPath of(String kind) {
        return new KeyPath(List.of(new Name(kind)));
    }

    public List<Segment> segments() {
        return segments;
    }

    public int length() {
        return segments.size();
    }

    public KeyPath name(String name) {
        return append(new Name(name));
    }

    public KeyPath index(int index) {
        return append(new Index(index));
    }

    public KeyPath append(Segment segment) {
        List<Segment> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(segment);
        return new KeyPath(next);
    }

    /** Whether the path has no wildcard segments. */
    public boolean isConcrete() {
        for (Segment s : segments) {
            if (s instanceof AnyName || s instanceof AnyIndex) {
                return false;
            }
        }
        return true;
    }

    /** Whether this pattern matches a concrete path. */
    public boolean matches(KeyPath concrete) {
        if (concrete.length() != length()) {
            return false;
        }
        for (int i = 0; i < segments.size(); i++) {
            if (!matches(segments.get(i), concrete.segments.get(i))) {
                return false;
            }
        }
        return true;
    }

    static boolean matches(Segment pattern, Segment concrete) {
        if (pattern instanceof AnyName) {
            return concrete instanceof Name || concrete instanceof AnyName;
        }
        if (pattern instanceof AnyIndex) {
            return concrete instanceof Index || concrete instanceof AnyIndex;
        }
        return pattern.equals(concrete);
    }

    /** Rendering without the leading kind segment, as reported for unmapped keys. */
    public String withoutKind() {
        String full = render(segments.subList(1, segments.size()));
        return full.startsWith(".") ? full.substring(1) : full;
    }

    @Override
    public String toString() {
        return render(segments);
    }

    private static String render(List<Segment> segments) {
        StringBuilder sb = new StringBuilder();
        for (Segment s : segments) {
            if (s instanceof Name n) {
                if (needsQuoting(n.name())) {
                    sb.append("[\"").append(n.name().replace("\\", "\\\\").replace("\"", "\\\"")).append("\"]");
                } else {
                    if (sb.length() > 0) {
                        sb.append('.');
                    }
                    sb.append(n.name());
                }
            } else if (s instanceof Index i) {
                sb.append('[').append(i.index()).append(']');
            } else if (s instanceof AnyIndex) {
                sb.append("[*]");
            } else {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append('*');
            }
        }
        return sb.toString();
    }

    private static boolean needsQuoting(String name) {
        return name.isEmpty()
                || name.equals("*")
                || name.indexOf('.') >= 0
                || name.indexOf('[') >= 0
                || name.indexOf(']') >= 0
                || name.indexOf('"') >= 0;
    }

    /**
     * @throws IllegalArgumentException if the text is not a well-formed path
     */
    public static KeyPath parse(String text) {
        List<Segment> out = new ArrayList<>();
        int i = 0;
        int n = text.length();
        boolean expectName = true;
        while (i < n) {
            char c = text.charAt(i);
            if (c == '[') {
                int close;
                if (i + 1 < n && text.charAt(i + 1) == '"') {
                    StringBuilder name = new StringBuilder();
                    int j = i + 2;
                    while (j < n && text.charAt(j) != '"') {
                        if (text.charAt(j) == '\\' && j + 1 < n) {
                            j++;
                        }
                        name.append(text.charAt(j++));
                    }
                    if (j + 1 >= n || text.charAt(j + 1) != ']') {
                        throw new IllegalArgumentException("Unterminated quoted key in '" + text + "'");
                    }
                    out.add(new Name(name.toString()));
                    close = j + 1;
                } else {
                    close = text.indexOf(']', i);
                    if (close < 0) {
                        throw new IllegalArgumentException("Unterminated index in '" + text + "'");
                    }
                    String inner = text.substring(i + 1, close);
                    if (inner.equals("*")) {
                        out.add(ANY_INDEX);
                    } else {
                        try {
                            out.add(new Index(Integer.parseInt(inner)));
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("Bad index '" + inner + "' in '" + text + "'", e);
                        }
                    }
                }
                i = close + 1;
                expectName = false;
            } else if (c == '.') {
                if (expectName) {
                    throw new IllegalArgumentException("Empty key in '" + text + "'");
                }
                i++;
                expectName = true;
            } else {
                int end = i;
                while (end < n && text.charAt(end) != '.' && text.charAt(end) != '[') {
                    end++;
                }
                String name = text.substring(i, end);
                out.add(name.equals("*") ? ANY_NAME : new Name(name));
                i = end;
                expectName = false;
            }
        }
        if (out.isEmpty() || expectName) {
            throw new IllegalArgumentException("Malformed key path '" + text + "'");
        }
        if (!(out.get(0) instanceof Name)) {
            throw new IllegalArgumentException("Key path '" + text + "' must start with a kind");
        }
        return new KeyPath(out);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof KeyPath other && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }
}
