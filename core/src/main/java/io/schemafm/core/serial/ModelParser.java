package io.schemafm.core.serial;

import io.schemafm.core.error.ModelParseException;
import io.schemafm.core.model.AttributeConstraint;
import io.schemafm.core.model.Cardinality;
import io.schemafm.core.model.Constraint;
import io.schemafm.core.model.FeatureFlag;
import io.schemafm.core.model.FeatureModel;
import io.schemafm.core.model.FeatureNode;
import io.schemafm.core.model.GroupType;
import io.schemafm.core.schema.ScalarType;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the format written by {@link ModelSerializer}. Features inside {@code or} and
 * {@code alternative} blocks are read as mandatory members; a non-abstract feature without a
 * {@code key} attribute takes its simple name as key.
 */
public final class ModelParser {

    private enum Section {
        NONE,
        FEATURES,
        CONSTRAINTS,
        ALIASES
    }

    private final String source;
    private String namespace;
    private FeatureNode.Builder root;
    private final List<FeatureNode.Builder> featureAt = new ArrayList<>();
    private final List<String> groupAt = new ArrayList<>();
    private final List<Constraint> constraints = new ArrayList<>();
    private final Map<String, String> descriptions = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();

    private ModelParser(String source) {
        this.source = source;
    }

    public static FeatureModel read(Path path) {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ModelParseException("Cannot read model file", e, path.toString());
        }
        return parse(text, path.toString());
    }

    /**
     * @param source name of the text's origin, used in error messages
     * @throws ModelParseException if the text is malformed or the model breaks an invariant
     */
    public static FeatureModel parse(String text, String source) {
        return new ModelParser(source).run(text);
    }

    private FeatureModel run(String text) {
        Section section = Section.NONE;
        String[] lines = text.split("\r?\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int lineNo = i + 1;
            if (line.isBlank()) {
                continue;
            }
            int depth = 0;
            while (depth < line.length() && line.charAt(depth) == '\t') {
                depth++;
            }
            String content = line.substring(depth).stripTrailing();
            try {
                if (depth == 0) {
                    section = header(content, lineNo);
                    continue;
                }
                switch (section) {
                    case FEATURES -> featureSectionLine(depth, content, lineNo);
                    case CONSTRAINTS -> constraints.add(Constraint.of(ExpressionParser.parse(content), null));
                    case ALIASES -> alias(content, lineNo);
                    default -> throw new ModelParseException("Indented line outside any section", source, lineNo);
                }
            } catch (IllegalStateException | IllegalArgumentException e) {
                throw new ModelParseException(e.getMessage(), source, lineNo);
            }
        }
        if (namespace == null) {
            throw new ModelParseException("Missing namespace line", source, 0);
        }
        if (root == null) {
            throw new ModelParseException("Model has no features", source, 0);
        }
        try {
            return new FeatureModel(namespace, root.build(), constraints, descriptions, aliases);
        } catch (IllegalArgumentException e) {
            throw new ModelParseException(e.getMessage(), e, source);
        }
    }

    private Section header(String content, int lineNo) {
        if (content.startsWith("namespace ")) {
            if (namespace != null) {
                throw new ModelParseException("Duplicate namespace line", source, lineNo);
            }
            namespace = content.substring("namespace ".length()).strip();
            return Section.NONE;
        }
        return switch (content) {
            case "features" -> Section.FEATURES;
            case "constraints" -> Section.CONSTRAINTS;
            case "aliases" -> Section.ALIASES;
            default -> throw new ModelParseException("Unknown section '" + content + "'", source, lineNo);
        };
    }

    private void featureSectionLine(int depth, String content, int lineNo) {
        GroupType group = GroupType.fromKeyword(content);
        if (group != null) {
            FeatureNode.Builder owner = at(featureAt, depth - 1);
            if (owner == null) {
                throw new ModelParseException("Group '" + content + "' without a feature", source, lineNo);
            }
            if (!owner.children().isEmpty() && owner.group() != group) {
                throw new ModelParseException("Feature " + owner.id() + " mixes group types", source, lineNo);
            }
            owner.group(group);
            set(groupAt, depth, content);
            set(featureAt, depth, null);
            return;
        }

        FeatureNode.Builder feature = feature(content);
        if (depth == 1) {
            if (root != null) {
                throw new ModelParseException("Second root feature " + feature.id(), source, lineNo);
            }
            root = feature;
        } else {
            String keyword = at(groupAt, depth - 1);
            FeatureNode.Builder parent = at(featureAt, depth - 2);
            if (keyword == null || parent == null) {
                throw new ModelParseException("Feature " + feature.id() + " is not inside a group", source, lineNo);
            }
            feature.cardinality("optional".equals(keyword) ? Cardinality.OPTIONAL : Cardinality.MANDATORY);
            parent.addChild(feature);
        }
        set(featureAt, depth, feature);
        // deeper levels belong to the previous sibling
        truncate(featureAt, depth + 1);
        truncate(groupAt, depth + 1);
    }

    /** {@code [Type] id [{attribute, ...}]} */
    private FeatureNode.Builder feature(String content) {
        Tokenizer t = new Tokenizer(content);
        String first = t.word();
        ScalarType type = null;
        String id = first;
        if (t.peek().type() == Token.Type.WORD) {
            type = ScalarType.fromKeyword(first);
            if (type == null) {
                throw new IllegalStateException("unknown type '" + first + "'");
            }
            id = t.word();
        }
        FeatureNode.Builder b = FeatureNode.builder(id).cardinality(Cardinality.MANDATORY);
        String key = null;
        List<String> enumValues = new ArrayList<>();
        BigDecimal min = null;
        BigDecimal max = null;
        if (t.accept("{")) {
            do {
                String name = t.word();
                FeatureFlag flag = FeatureFlag.fromKeyword(name);
                if (flag != null) {
                    b.flag(flag);
                    continue;
                }
                switch (name) {
                    case "key" -> key = t.string();
                    case "source" -> b.provenance(t.string());
                    case "doc" -> descriptions.put(id, t.string());
                    case "min" -> min = new BigDecimal(t.word());
                    case "max" -> max = new BigDecimal(t.word());
                    case "enum" -> {
                        t.expect("[");
                        if (!t.accept("]")) {
                            do {
                                enumValues.add(t.string());
                            } while (t.accept(","));
                            t.expect("]");
                        }
                    }
                    default -> throw new IllegalStateException("unknown attribute '" + name + "'");
                }
            } while (t.accept(","));
            t.expect("}");
        }
        if (!t.atEnd()) {
            throw new IllegalStateException("unexpected " + t.peek() + " after feature " + id);
        }
        if (type != null) {
            b.attribute(new AttributeConstraint(type, enumValues, min, max));
        } else if (!enumValues.isEmpty() || min != null || max != null) {
            throw new IllegalStateException("value attributes on untyped feature " + id);
        }
        if (key == null && !b.has(FeatureFlag.ABSTRACT)) {
            key = id.substring(id.lastIndexOf('.') + 1);
        }
        return b.key(key);
    }

    private void alias(String content, int lineNo) {
        Tokenizer t = new Tokenizer(content);
        String alias = t.word();
        t.expect("=>");
        String canonical = t.word();
        if (!t.atEnd()) {
            throw new ModelParseException("Malformed alias line", source, lineNo);
        }
        aliases.put(alias, canonical);
    }

    private static <T> T at(List<T> list, int index) {
        return index >= 0 && index < list.size() ? list.get(index) : null;
    }

    private static <T> void set(List<T> list, int index, T value) {
        while (list.size() <= index) {
            list.add(null);
        }
        list.set(index, value);
    }

    private static <T> void truncate(List<T> list, int size) {
        while (list.size() > size) {
            list.remove(list.size() - 1);
        }
    }
}
