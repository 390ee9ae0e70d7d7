package de.julielab.jules.ae.placemapping.classification;

import java.util.Objects;

import de.julielab.jules.ae.placemapping.textmodel.MentionCategory;

public class ClassificationResult {
    private final boolean place;
    private final double confidence;
    private final MentionCategory category;
    private final String reasoning;
    private final String suggestedModernRegion;

    public ClassificationResult(boolean place, double confidence, MentionCategory category, String reasoning,
                                String suggestedModernRegion) {
        this.place = place;
        this.confidence = confidence;
        this.category = category;
        this.reasoning = reasoning;
        this.suggestedModernRegion = suggestedModernRegion;
    }

    public static ClassificationResult place(double confidence, MentionCategory category, String reasoning) {
        return new ClassificationResult(true, confidence, category, reasoning, null);
    }

    public static ClassificationResult nonPlace(double confidence, MentionCategory category, String reasoning) {
        return new ClassificationResult(false, confidence, category, reasoning, null);
    }

    public boolean isPlace() {
        return place;
    }

    public double getConfidence() {
        return confidence;
    }

    public MentionCategory getCategory() {
        return category;
    }

    public String getReasoning() {
        return reasoning;
    }

    /**
     * @return the modern region of a historical place name or <tt>null</tt>
     */
    public String getSuggestedModernRegion() {
        return suggestedModernRegion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        ClassificationResult that = (ClassificationResult) o;
        return place == that.place && Double.compare(that.confidence, confidence) == 0 && category == that.category
                && Objects.equals(reasoning, that.reasoning)
                && Objects.equals(suggestedModernRegion, that.suggestedModernRegion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(place, confidence, category, reasoning, suggestedModernRegion);
    }

    @Override
    public String toString() {
        return "ClassificationResult [place=" + place + ", confidence=" + confidence + ", category=" + category
                + ", reasoning=" + reasoning + ", suggestedModernRegion=" + suggestedModernRegion + "]";
    }
}
