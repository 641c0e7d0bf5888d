package io.schemafm.core.constraint;

import io.schemafm.core.model.Constraint;
import io.schemafm.core.schema.Definition;
import io.schemafm.core.schema.Property;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Base of rules that read constraints out of description prose, one sentence at a time. A
 * sentence that yields at least one constraint is marked converted.
 */
public abstract class DescriptionRule implements DerivationRule {

    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");

    @Override
    public final List<Constraint> derive(DerivationContext context) {
        List<Constraint> out = new ArrayList<>();
        for (Sentence sentence : sentences(context)) {
            List<Constraint> found = fromSentence(context, sentence);
            if (!found.isEmpty()) {
                context.markConverted(sentence.key());
                out.addAll(found);
            }
        }
        return out;
    }

    protected abstract List<Constraint> fromSentence(DerivationContext context, Sentence sentence);

    protected String trace(Sentence sentence) {
        return name() + "@" + sentence.subject();
    }

    /** Sentences of the definition descriptions and property descriptions of the feature. */
    static List<Sentence> sentences(DerivationContext context) {
        List<Sentence> out = new ArrayList<>();
        for (Definition d : context.definitions()) {
            split(d.name(), null, d.description(), out);
            for (Property p : d.properties()) {
                split(d.name() + "/properties/" + p.name(), p, p.description(), out);
            }
        }
        return out;
    }

    private static void split(String subject, Property property, String text, List<Sentence> out) {
        if (text == null || text.isBlank()) {
            return;
        }
        for (String s : SENTENCE_BREAK.split(text.strip())) {
            if (!s.isBlank()) {
                out.add(new Sentence(subject, property, s.strip()));
            }
        }
    }

    /**
     * @param subject  schema location of the description
     * @param property the described property, {@code null} for a definition-level description
     * @param text     the sentence
     */
    public record Sentence(String subject, Property property, String text) {
        String key() {
            return subject + '\u0000' + text;
        }
    }
}
