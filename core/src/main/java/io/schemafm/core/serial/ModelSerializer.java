package io.schemafm.core.serial;

import io.schemafm.core.model.AttributeConstraint;
import io.schemafm.core.model.Cardinality;
import io.schemafm.core.model.Constraint;
import io.schemafm.core.model.FeatureFlag;
import io.schemafm.core.model.FeatureModel;
import io.schemafm.core.model.FeatureNode;
import io.schemafm.core.model.GroupType;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link FeatureModel} in the textual model format. Output is a fixed depth-first walk
 * in model order, so an unchanged model always renders to the same bytes.
 *
 * <pre>
 * namespace k8s
 * features
 * 	k8s {abstract}
 * 		or
 * 			Pod {source 'io.k8s.api.core.v1.Pod'}
 * 				mandatory
 * 					String Pod.kind
 * 				optional
 * 					Pod.spec
 * constraints
 * 	Pod.spec.a => Pod.spec.b
 * aliases
 * 	Pod.spec.x => Pod.spec.y
 * </pre>
 */
public final class ModelSerializer {

    private final boolean inlineDescriptions;

    /** Serializer that leaves descriptions to the separate descriptions file. */
    public ModelSerializer() {
        this(false);
    }

    /**
     * @param inlineDescriptions write each description as a {@code doc} attribute
     */
    public ModelSerializer(boolean inlineDescriptions) {
        this.inlineDescriptions = inlineDescriptions;
    }

    public String write(FeatureModel model) {
        StringBuilder out = new StringBuilder();
        out.append("namespace ").append(model.namespace()).append('\n');
        out.append("features\n");
        writeFeatures(model, out);
        if (!model.constraints().isEmpty()) {
            out.append("constraints\n");
            for (Constraint c : model.constraints()) {
                out.append('\t').append(c.render()).append('\n');
            }
        }
        if (!model.aliases().isEmpty()) {
            out.append("aliases\n");
            for (Map.Entry<String, String> a : model.aliases().entrySet()) {
                out.append('\t').append(a.getKey()).append(" => ").append(a.getValue()).append('\n');
            }
        }
        return out.toString();
    }

    public void write(FeatureModel model, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, write(model), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write model to " + target, e);
        }
    }

    /** Iterative walk; a work item is either a feature line or a group keyword line. */
    private void writeFeatures(FeatureModel model, StringBuilder out) {
        Deque<Item> stack = new ArrayDeque<>();
        stack.push(new Item(model.root(), null, 1));
        while (!stack.isEmpty()) {
            Item item = stack.pop();
            if (item.keyword() != null) {
                indent(out, item.depth()).append(item.keyword()).append('\n');
                continue;
            }
            FeatureNode f = item.feature();
            indent(out, item.depth()).append(featureLine(f, model.description(f.id()))).append('\n');

            List<Item> blocks = new ArrayList<>();
            if (f.group() == GroupType.AND) {
                addBlock(blocks, "mandatory", members(f, Cardinality.MANDATORY), item.depth());
                addBlock(blocks, "optional", members(f, Cardinality.OPTIONAL), item.depth());
            } else {
                addBlock(blocks, f.group().keyword(), f.children(), item.depth());
            }
            for (int i = blocks.size() - 1; i >= 0; i--) {
                stack.push(blocks.get(i));
            }
        }
    }

    private static void addBlock(List<Item> blocks, String keyword, List<FeatureNode> members, int depth) {
        if (members.isEmpty()) {
            return;
        }
        blocks.add(new Item(null, keyword, depth + 1));
        for (FeatureNode m : members) {
            blocks.add(new Item(m, null, depth + 2));
        }
    }

    private static List<FeatureNode> members(FeatureNode f, Cardinality cardinality) {
        List<FeatureNode> out = new ArrayList<>();
        for (FeatureNode c : f.children()) {
            if (c.cardinality() == cardinality) {
                out.add(c);
            }
        }
        return out;
    }

    String featureLine(FeatureNode f, String description) {
        StringBuilder line = new StringBuilder();
        AttributeConstraint attribute = f.attribute();
        if (attribute != null) {
            line.append(attribute.type().keyword()).append(' ');
        }
        line.append(f.id());

        List<String> attrs = new ArrayList<>();
        for (FeatureFlag flag : FeatureFlag.values()) {
            if (f.has(flag)) {
                attrs.add(flag.keyword());
            }
        }
        if (f.key() != null && !f.key().equals(f.simpleName())) {
            attrs.add("key " + Literals.quote(f.key()));
        }
        if (attribute != null) {
            if (attribute.enumerated()) {
                List<String> values = new ArrayList<>();
                attribute.enumValues().forEach(v -> values.add(Literals.quote(v)));
                attrs.add("enum [" + String.join(", ", values) + "]");
            }
            if (attribute.minimum() != null) {
                attrs.add("min " + attribute.minimum().toPlainString());
            }
            if (attribute.maximum() != null) {
                attrs.add("max " + attribute.maximum().toPlainString());
            }
        }
        if (f.provenance() != null) {
            attrs.add("source " + Literals.quote(f.provenance()));
        }
        if (inlineDescriptions && description != null) {
            attrs.add("doc " + Literals.quote(description));
        }
        if (!attrs.isEmpty()) {
            line.append(" {").append(String.join(", ", attrs)).append('}');
        }
        return line.toString();
    }

    private static StringBuilder indent(StringBuilder out, int depth) {
        for (int i = 0; i < depth; i++) {
            out.append('\t');
        }
        return out;
    }

    private record Item(FeatureNode feature, String keyword, int depth) {}
}
