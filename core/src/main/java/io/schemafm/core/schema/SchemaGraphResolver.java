package io.schemafm.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.schemafm.core.error.Diagnostic;
import io.schemafm.core.error.Diagnostics;
import io.schemafm.core.error.UnresolvedReferenceException;
import io.schemafm.core.error.UnsupportedConstructException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a flat map of raw definitions into a {@link SchemaGraph}.
 *
 * <p>
 * Expansion is driven by an explicit work queue. Resolving a reference only schedules the target
 * by name; the target is materialized later, when it is taken off the queue. A self-referencing
 * definition is therefore scheduled once and never recursed into. Only definitions reachable from
 * the requested roots are materialized. Inline schemas (property values, array items, branches) get
 * synthetic names under their owner, e.g. {@code Pod/properties/spec}.
 *
 * <p>
 * Schema problems never abort resolution: unresolved references and unsupported constructs are
 * recorded in the supplied {@link Diagnostics} and the affected branch degrades.
 *
 * <p>
 * Not thread-safe; use one instance per build.
 */
public final class SchemaGraphResolver {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaGraphResolver.class);

    /** Keywords outside the supported operator subset. */
    private static final List<String> UNSUPPORTED_KEYWORDS = List.of(
            "not",
            "patternProperties",
            "dependentSchemas",
            "unevaluatedProperties",
            "unevaluatedItems",
            "prefixItems",
            "contains");

    private static final String GVK_EXTENSION = "x-kubernetes-group-version-kind";

    private final Map<String, JsonNode> raw;
    private final Diagnostics diagnostics;
    private final Map<String, JsonNode> pending = new LinkedHashMap<>();
    private final Map<String, Definition> arena = new LinkedHashMap<>();
    private final Set<String> scheduled = new HashSet<>();
    private final Deque<String> queue = new ArrayDeque<>();

    public SchemaGraphResolver(Map<String, JsonNode> raw, Diagnostics diagnostics) {
        this.raw = Objects.requireNonNull(raw, "raw must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
    }

    /**
     * Resolves the given roots, or the default root set when {@code requestedRoots} is empty: all
     * definitions carrying {@code x-kubernetes-group-version-kind}, or every definition if none do.
     */
    public SchemaGraph resolve(List<String> requestedRoots) {
        List<String> roots = requestedRoots.isEmpty() ? defaultRoots() : requestedRoots;
        List<String> resolvedRoots = new ArrayList<>();
        Map<String, String> kindNames = new LinkedHashMap<>();
        for (String root : roots) {
            String name = normalizeReference(root);
            if (!raw.containsKey(name)) {
                diagnostics.add(Diagnostic.of(new UnresolvedReferenceException("<roots>", root)));
                continue;
            }
            if (!resolvedRoots.contains(name)) {
                resolvedRoots.add(name);
                kindNames.put(name, kindName(name, raw.get(name)));
                schedule(name, raw.get(name));
            }
        }
        while (!queue.isEmpty()) {
            String name = queue.poll();
            JsonNode node = pending.remove(name);
            arena.put(name, materialize(name, node));
        }
        LOG.info(
                "Resolved {} definitions ({} raw, {} roots, {} eliminated as unreachable)",
                arena.size(),
                raw.size(),
                resolvedRoots.size(),
                raw.keySet().stream().filter(n -> !arena.containsKey(n)).count());
        return new SchemaGraph(arena, resolvedRoots, kindNames);
    }

    private List<String> defaultRoots() {
        List<String> withKind = raw.entrySet().stream()
                .filter(e -> e.getValue().has(GVK_EXTENSION))
                .map(Map.Entry::getKey)
                .toList();
        return withKind.isEmpty() ? List.copyOf(raw.keySet()) : withKind;
    }

    private static String kindName(String name, JsonNode node) {
        JsonNode gvk = node.path(GVK_EXTENSION);
        if (gvk.isArray() && gvk.size() > 0 && gvk.get(0).hasNonNull("kind")) {
            return gvk.get(0).get("kind").asText();
        }
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }

    private void schedule(String name, JsonNode node) {
        if (scheduled.add(name)) {
            pending.put(name, node);
            queue.add(name);
        }
    }

    /**
     * Resolves a {@code $ref} to a definition name, scheduling it if needed. Returns {@code null}
     * and records a warning when the target is missing.
     */
    private String reference(String owner, String ref) {
        if (isRemote(ref)) {
            throw new UnsupportedConstructException(owner, "remote $ref " + ref);
        }
        String name = normalizeReference(ref);
        JsonNode target = raw.get(name);
        if (target == null) {
            diagnostics.add(Diagnostic.of(new UnresolvedReferenceException(owner, ref)));
            return null;
        }
        schedule(name, target);
        return name;
    }

    /** Names an inline schema, or follows it when it is a bare reference. */
    private String inline(String owner, String path, JsonNode node) {
        if (node.has("$ref") && isPureReference(node)) {
            return reference(owner, node.get("$ref").asText());
        }
        String name = owner + "/" + path;
        schedule(name, node);
        return name;
    }

    /**
     * Like {@link #inline}, but a missing reference target keeps its name so the element reads as
     * unknown rather than unconstrained.
     */
    private String element(String owner, String path, JsonNode node) {
        String name = inline(owner, path, node);
        if (name == null && node.has("$ref")) {
            return normalizeReference(node.get("$ref").asText());
        }
        return name;
    }

    private static boolean isPureReference(JsonNode node) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String field = names.next();
            if (!field.equals("$ref") && !isAnnotation(field)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isAnnotation(String field) {
        return switch (field) {
            case "description", "title", "default", "example", "examples", "deprecated", "readOnly", "writeOnly",
                    "format", "pattern", "minLength", "maxLength", "minItems", "maxItems", "uniqueItems",
                    "nullable", "$comment", "externalDocs" -> true;
            default -> field.startsWith("x-");
        };
    }

    static boolean isRemote(String ref) {
        return ref.startsWith("http://") || ref.startsWith("https://") || (ref.contains("#") && !ref.startsWith("#"));
    }

    /** Strips local JSON-pointer prefixes: {@code #/definitions/X} and friends become {@code X}. */
    static String normalizeReference(String ref) {
        String name = ref;
        for (String prefix : List.of("#/definitions/", "#/components/schemas/", "#/$defs/")) {
            if (name.startsWith(prefix)) {
                name = name.substring(prefix.length());
                break;
            }
        }
        return name.replace("~1", "/").replace("~0", "~");
    }

    private Definition materialize(String name, JsonNode node) {
        try {
            return build(name, node);
        } catch (UnsupportedConstructException e) {
            diagnostics.add(Diagnostic.of(e));
            return Definition.unknown(name, e.construct(), textOrNull(node, "description"));
        }
    }

    private Definition build(String name, JsonNode node) {
        if (node == null || node.isBoolean()) {
            return Definition.builder(name, DefinitionKind.OPEN).build();
        }
        if (!node.isObject()) {
            throw new UnsupportedConstructException(name, "non-object schema node");
        }
        for (String keyword : UNSUPPORTED_KEYWORDS) {
            if (node.has(keyword)) {
                throw new UnsupportedConstructException(name, keyword);
            }
        }

        Definition.Builder b = Definition.builder(name, DefinitionKind.OPEN);
        b.description(textOrNull(node, "description"));
        b.nullable(node.path("nullable").asBoolean(false) || node.path("x-nullable").asBoolean(false));

        String type = schemaType(name, node, b);

        if (node.path("x-kubernetes-int-or-string").asBoolean(false)
                || "int-or-string".equals(node.path("format").asText())) {
            b.kind(DefinitionKind.UNION);
            b.branch(inlineScalar(name, "oneOf/0", "integer"));
            b.branch(inlineScalar(name, "oneOf/1", "string"));
            return b.build();
        }

        if (node.has("$ref")) {
            // a reference with structural siblings merges like allOf
            String target = reference(name, node.get("$ref").asText());
            b.kind(DefinitionKind.INTERSECTION);
            if (target != null) {
                b.branch(target);
            }
            if (isPureReference(node)) {
                return b.build();
            }
        }

        readProperties(name, node, b);
        readConditionals(name, node, b);

        if (node.has("allOf")) {
            b.kind(DefinitionKind.INTERSECTION);
            for (String branch : branches(name, "allOf", node.get("allOf"))) {
                b.branch(branch);
            }
        }
        if (node.has("oneOf") && node.has("anyOf")) {
            // each keyword becomes a separate choice member of an intersection
            b.kind(DefinitionKind.INTERSECTION);
            for (String keyword : List.of("oneOf", "anyOf")) {
                String member = name + "/" + keyword;
                schedule(member, JsonNodeFactory.instance.objectNode().set(keyword, node.get(keyword)));
                b.branch(member);
            }
            return b.build();
        }
        for (String keyword : List.of("oneOf", "anyOf")) {
            if (!node.has(keyword)) {
                continue;
            }
            DefinitionKind choice = keyword.equals("oneOf") ? DefinitionKind.UNION : DefinitionKind.DISJUNCTION;
            List<String> branches = branches(name, keyword, node.get(keyword));
            if (b.hasProperties() || b.kind() == DefinitionKind.INTERSECTION) {
                b.choice(choice, branches);
                if (b.kind() == DefinitionKind.OPEN) {
                    b.kind(DefinitionKind.OBJECT);
                }
            } else {
                b.kind(choice);
                branches.forEach(b::branch);
            }
            return b.build();
        }
        if (b.kind() == DefinitionKind.INTERSECTION) {
            return b.build();
        }
        if (b.hasProperties()) {
            return b.kind(DefinitionKind.OBJECT).build();
        }

        JsonNode additional = node.get("additionalProperties");
        if (additional != null && (additional.isObject() || additional.asBoolean(false))) {
            b.kind(DefinitionKind.MAP);
            if (additional.isObject() && additional.size() > 0) {
                b.element(element(name, "additionalProperties", additional));
            }
            return b.build();
        }
        if (node.has("items") || "array".equals(type)) {
            JsonNode items = node.get("items");
            if (items != null && items.isArray()) {
                throw new UnsupportedConstructException(name, "tuple items");
            }
            b.kind(DefinitionKind.ARRAY);
            if (items != null && items.isObject() && items.size() > 0) {
                b.element(element(name, "items", items));
            }
            return b.build();
        }
        ScalarType scalar = type == null ? null : ScalarType.fromSchemaType(type);
        if (scalar == null && node.has("enum") && node.get("enum").size() > 0) {
            scalar = ScalarType.ofLiteral(node.get("enum").get(0));
        }
        if (scalar != null) {
            b.kind(DefinitionKind.SCALAR).scalarType(scalar);
            for (JsonNode value : node.path("enum")) {
                if (!value.isNull()) {
                    b.enumValue(value.asText());
                }
            }
            if (node.has("minimum") && node.get("minimum").isNumber()) {
                b.minimum(node.get("minimum").decimalValue());
            }
            if (node.has("maximum") && node.get("maximum").isNumber()) {
                b.maximum(node.get("maximum").decimalValue());
            }
            return b.build();
        }
        // type: object without members, or no type at all
        return b.build();
    }

    /** Reads {@code type}, folding {@code "null"} out of type arrays into the nullable flag. */
    private static String schemaType(String name, JsonNode node, Definition.Builder b) {
        JsonNode typeNode = node.get("type");
        if (typeNode == null) {
            return null;
        }
        List<String> types = new ArrayList<>();
        if (typeNode.isArray()) {
            typeNode.forEach(t -> types.add(t.asText()));
        } else {
            types.add(typeNode.asText());
        }
        if (types.remove("null")) {
            b.nullable(true);
        }
        if (types.size() != 1) {
            throw new UnsupportedConstructException(name, "type " + typeNode);
        }
        String type = types.get(0);
        if (!type.equals("object") && !type.equals("array") && ScalarType.fromSchemaType(type) == null) {
            throw new UnsupportedConstructException(name, "type '" + type + "'");
        }
        return type;
    }

    private void readProperties(String name, JsonNode node, Definition.Builder b) {
        JsonNode properties = node.get("properties");
        if (properties == null || !properties.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String property = field.getKey();
            JsonNode schema = field.getValue();
            String description = textOrNull(schema, "description");
            boolean deprecated = schema.path("deprecated").asBoolean(false)
                    || (description != null && description.regionMatches(true, 0, "deprecated", 0, 10));
            String target = inline(name, "properties/" + property, schema);
            b.property(new Property(property, target, description, deprecated));
        }
        for (JsonNode required : node.path("required")) {
            b.required(required.asText());
        }
    }

    /** {@code if}/{@code then} pinning one sibling, {@code dependentRequired}, array-form {@code dependencies}. */
    private static void readConditionals(String name, JsonNode node, Definition.Builder b) {
        JsonNode ifNode = node.path("if").path("properties");
        JsonNode thenRequired = node.path("then").path("required");
        if (ifNode.isObject() && ifNode.size() == 1 && thenRequired.isArray()) {
            Map.Entry<String, JsonNode> test = ifNode.fields().next();
            JsonNode pinned = test.getValue().has("const")
                    ? test.getValue().get("const")
                    : test.getValue().path("enum").size() == 1 ? test.getValue().get("enum").get(0) : null;
            if (pinned != null) {
                b.conditional(new ConditionalRequirement(test.getKey(), pinned.asText(), texts(thenRequired)));
            } else {
                LOG.debug("Ignoring if/then in {}: condition does not pin a single value", name);
            }
        }
        for (String keyword : List.of("dependentRequired", "dependencies")) {
            Iterator<Map.Entry<String, JsonNode>> deps = node.path(keyword).fields();
            while (deps.hasNext()) {
                Map.Entry<String, JsonNode> dep = deps.next();
                if (dep.getValue().isArray()) {
                    b.conditional(new ConditionalRequirement(dep.getKey(), null, texts(dep.getValue())));
                }
            }
        }
    }

    private List<String> branches(String name, String keyword, JsonNode list) {
        if (!list.isArray()) {
            throw new UnsupportedConstructException(name, keyword + " without a list");
        }
        List<String> branches = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            String branch = inline(name, keyword + "/" + i, list.get(i));
            if (branch != null) {
                branches.add(branch);
            }
        }
        return branches;
    }

    private String inlineScalar(String owner, String path, String type) {
        String name = owner + "/" + path;
        schedule(name, JsonNodeFactory.instance.objectNode().put("type", type));
        return name;
    }

    private static List<String> texts(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(v -> values.add(v.asText()));
        return values;
    }

    private static String textOrNull(JsonNode node, String field) {
        return node != null && node.hasNonNull(field) ? node.get(field).asText() : null;
    }
}
