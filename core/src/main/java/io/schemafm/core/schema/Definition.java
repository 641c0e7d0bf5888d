package io.schemafm.core.schema;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One materialized schema node, owned by a {@link SchemaGraph}. Other definitions are referenced
 * by qualified name only, so the graph may contain cycles while each definition stays a plain
 * immutable value.
 *
 * <p>
 * Which fields are meaningful depends on {@link #kind()}:
 * <ul>
 * <li>{@code OBJECT}: {@link #properties()}, {@link #required()}, plus an optional
 * {@link #choiceKind()} and {@link #branches()} for a {@code oneOf}/{@code anyOf} declared next
 * to the properties</li>
 * <li>{@code MAP}, {@code ARRAY}: {@link #element()}</li>
 * <li>{@code SCALAR}: {@link #scalarType()}, {@link #enumValues()}, {@link #minimum()},
 * {@link #maximum()}</li>
 * <li>{@code UNION}, {@code DISJUNCTION}: {@link #branches()}</li>
 * <li>{@code INTERSECTION}: {@link #branches()}, plus any properties declared inline</li>
 * </ul>
 */
public final class Definition {

    private final String name;
    private final DefinitionKind kind;
    private final List<Property> properties;
    private final Set<String> required;
    private final DefinitionKind choiceKind;
    private final List<String> branches;
    private final String element;
    private final ScalarType scalarType;
    private final List<String> enumValues;
    private final BigDecimal minimum;
    private final BigDecimal maximum;
    private final String description;
    private final boolean nullable;
    private final List<ConditionalRequirement> conditionals;
    private final String unsupported;

    private Definition(Builder b) {
        this.name = b.name;
        this.kind = b.kind;
        this.properties = Collections.unmodifiableList(new ArrayList<>(b.properties));
        this.required = Collections.unmodifiableSet(new LinkedHashSet<>(b.required));
        this.choiceKind = b.choiceKind;
        this.branches = List.copyOf(b.branches);
        this.element = b.element;
        this.scalarType = b.scalarType;
        this.enumValues = List.copyOf(b.enumValues);
        this.minimum = b.minimum;
        this.maximum = b.maximum;
        this.description = b.description;
        this.nullable = b.nullable;
        this.conditionals = List.copyOf(b.conditionals);
        this.unsupported = b.unsupported;
    }

    public static Builder builder(String name, DefinitionKind kind) {
        return new Builder(name, kind);
    }

    /** An opaque definition standing in for vocabulary outside the supported subset. */
    public static Definition unknown(String name, String construct, String description) {
        Builder b = builder(name, DefinitionKind.UNKNOWN);
        b.unsupported = construct;
        b.description = description;
        return b.build();
    }

    public String name() {
        return name;
    }

    public DefinitionKind kind() {
        return kind;
    }

    public List<Property> properties() {
        return properties;
    }

    public Set<String> required() {
        return required;
    }

    public boolean isRequired(String property) {
        return required.contains(property);
    }

    /** {@code UNION} or {@code DISJUNCTION} for an object that also declares branches, else {@code null}. */
    public DefinitionKind choiceKind() {
        return choiceKind;
    }

    public List<String> branches() {
        return branches;
    }

    /** Element definition of an array, value definition of a map; {@code null} when open. */
    public String element() {
        return element;
    }

    public ScalarType scalarType() {
        return scalarType;
    }

    public List<String> enumValues() {
        return enumValues;
    }

    public BigDecimal minimum() {
        return minimum;
    }

    public BigDecimal maximum() {
        return maximum;
    }

    public String description() {
        return description;
    }

    public boolean nullable() {
        return nullable;
    }

    public List<ConditionalRequirement> conditionals() {
        return conditionals;
    }

    /** The unsupported keyword that made this definition opaque, or {@code null}. */
    public String unsupported() {
        return unsupported;
    }

    /** Last segment of a dotted qualified name: {@code io.k8s.api.core.v1.Pod} gives {@code Pod}. */
    public String shortName() {
        int slash = name.lastIndexOf('/');
        if (slash >= 0) {
            return name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Definition other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Definition[" + name + ", " + kind + "]";
    }

    /** Mutable builder used by the resolver while a node is being materialized. */
    public static final class Builder {
        private final String name;
        private DefinitionKind kind;
        private final List<Property> properties = new ArrayList<>();
        private final Set<String> required = new LinkedHashSet<>();
        private DefinitionKind choiceKind;
        private final List<String> branches = new ArrayList<>();
        private String element;
        private ScalarType scalarType;
        private final List<String> enumValues = new ArrayList<>();
        private BigDecimal minimum;
        private BigDecimal maximum;
        private String description;
        private boolean nullable;
        private final List<ConditionalRequirement> conditionals = new ArrayList<>();
        private String unsupported;

        Builder(String name, DefinitionKind kind) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.kind = Objects.requireNonNull(kind, "kind must not be null");
        }

        public Builder kind(DefinitionKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind must not be null");
            return this;
        }

        public DefinitionKind kind() {
            return kind;
        }

        public Builder property(Property property) {
            properties.add(property);
            return this;
        }

        public Builder required(String property) {
            required.add(property);
            return this;
        }

        public Builder choice(DefinitionKind choiceKind, List<String> branches) {
            this.choiceKind = choiceKind;
            this.branches.addAll(branches);
            return this;
        }

        public Builder branch(String branch) {
            branches.add(branch);
            return this;
        }

        public Builder element(String element) {
            this.element = element;
            return this;
        }

        public Builder scalarType(ScalarType scalarType) {
            this.scalarType = scalarType;
            return this;
        }

        public Builder enumValue(String value) {
            enumValues.add(value);
            return this;
        }

        public Builder minimum(BigDecimal minimum) {
            this.minimum = minimum;
            return this;
        }

        public Builder maximum(BigDecimal maximum) {
            this.maximum = maximum;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder nullable(boolean nullable) {
            this.nullable = nullable;
            return this;
        }

        public Builder conditional(ConditionalRequirement conditional) {
            conditionals.add(conditional);
            return this;
        }

        public boolean hasProperties() {
            return !properties.isEmpty();
        }

        public Definition build() {
            return new Definition(this);
        }
    }
}
