package de.julielab.jules.ae.placemapping.knowledge;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import de.julielab.jules.ae.placemapping.textmodel.MentionCategory;

/**
 * A context pattern that identifies a non-place use of a word, e.g. a plant
 * name followed by a growth verb. If the pattern defines the named group
 * <tt>target</tt>, the candidate must be exactly the text of that group.
 * Otherwise the candidate must occur within the whole match.
 */
public class ContextRule {
    public static final String TARGET_GROUP = "target";

    private final MentionCategory category;
    private final double confidence;
    private final Pattern pattern;
    private final boolean hasTarget;

    public ContextRule(MentionCategory category, double confidence, Pattern pattern) {
        this.category = category;
        this.confidence = confidence;
        this.pattern = pattern;
        this.hasTarget = pattern.pattern().contains("(?<" + TARGET_GROUP + ">");
    }

    /**
     * @param fullContext the text before, the sentence and the text after
     * @param candidate   the candidate place name
     * @return whether the rule matches and the candidate participates in a match
     */
    public boolean appliesTo(String fullContext, String candidate) {
        Matcher m = pattern.matcher(fullContext);
        while (m.find()) {
            if (hasTarget) {
                if (candidate.equals(m.group(TARGET_GROUP)))
                    return true;
            } else if (m.group().contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    public MentionCategory getCategory() {
        return category;
    }

    public double getConfidence() {
        return confidence;
    }

    public Pattern getPattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return "ContextRule [category=" + category + ", confidence=" + confidence + ", pattern=" + pattern + "]";
    }
}
