package de.julielab.jules.ae.placemapping.textmodel;

import java.util.Objects;

import org.apache.commons.lang3.Range;

/**
 * A place name mention that survived candidate coordination. There is at most
 * one accepted mention per distinct, non-redundant place name and sentence.
 * Mentions that were classified as something else than a place carry a
 * non-place {@link #getClassificationLabel() label} and never reach geocoding.
 */
public class AcceptedMention implements SpannedText {
    private final String documentId;
    private final String placeName;
    private final Range<Integer> span;
    private final double confidence;
    private final String sourceMethod;
    private final MentionCategory classificationLabel;
    private final String reasoning;
    private final String sentenceText;
    private final String contextBefore;
    private final String contextAfter;
    private final String suggestedModernRegion;

    public AcceptedMention(String placeName, int begin, int end, double confidence, String sourceMethod,
                           MentionCategory classificationLabel, String reasoning, SentenceContext context,
                           String suggestedModernRegion) {
        Objects.requireNonNull(placeName);
        Objects.requireNonNull(classificationLabel);
        if (Double.isNaN(confidence) || confidence < 0 || confidence > 1)
            throw new IllegalArgumentException("Confidence " + confidence + " of mention '" + placeName + "' is not in [0,1]");
        this.documentId = context.getDocumentId();
        this.placeName = placeName;
        this.span = Range.between(begin, end);
        this.confidence = confidence;
        this.sourceMethod = sourceMethod;
        this.classificationLabel = classificationLabel;
        this.reasoning = reasoning;
        this.sentenceText = context.getSentenceText();
        this.contextBefore = context.getBeforeText();
        this.contextAfter = context.getAfterText();
        this.suggestedModernRegion = suggestedModernRegion;
    }

    /**
     * Creates the mention for the representative candidate of a group of
     * candidates with identical text.
     */
    public static AcceptedMention of(Candidate representative, double confidence, MentionCategory classificationLabel,
                                     String reasoning, String suggestedModernRegion) {
        return new AcceptedMention(representative.getText(), representative.getBegin(), representative.getEnd(),
                confidence, representative.getSourceMethod(), classificationLabel, reasoning,
                representative.getSentenceContext(), suggestedModernRegion);
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getPlaceName() {
        return placeName;
    }

    @Override
    public String getText() {
        return placeName;
    }

    @Override
    public Range<Integer> getSpan() {
        return span;
    }

    @Override
    public double getConfidence() {
        return confidence;
    }

    public String getSourceMethod() {
        return sourceMethod;
    }

    public MentionCategory getClassificationLabel() {
        return classificationLabel;
    }

    public boolean isPlace() {
        return classificationLabel.isPlaceType();
    }

    public String getReasoning() {
        return reasoning;
    }

    public String getSentenceText() {
        return sentenceText;
    }

    public String getContextBefore() {
        return contextBefore;
    }

    public String getContextAfter() {
        return contextAfter;
    }

    /**
     * @return the modern region of a historical place name, <tt>null</tt> for
     * all other mentions
     */
    public String getSuggestedModernRegion() {
        return suggestedModernRegion;
    }

    public SentenceContext getSentenceContext() {
        return new SentenceContext(documentId, sentenceText, contextBefore, contextAfter);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        AcceptedMention that = (AcceptedMention) o;
        return Double.compare(that.confidence, confidence) == 0 && Objects.equals(documentId, that.documentId)
                && placeName.equals(that.placeName) && span.equals(that.span)
                && Objects.equals(sourceMethod, that.sourceMethod) && classificationLabel == that.classificationLabel
                && Objects.equals(reasoning, that.reasoning) && Objects.equals(sentenceText, that.sentenceText)
                && Objects.equals(suggestedModernRegion, that.suggestedModernRegion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentId, placeName, span, confidence, sourceMethod, classificationLabel, reasoning,
                sentenceText, suggestedModernRegion);
    }

    @Override
    public String toString() {
        return "AcceptedMention [placeName=" + placeName + ", span=" + span + ", confidence=" + confidence
                + ", sourceMethod=" + sourceMethod + ", label=" + classificationLabel + ", reasoning=" + reasoning + "]";
    }
}
