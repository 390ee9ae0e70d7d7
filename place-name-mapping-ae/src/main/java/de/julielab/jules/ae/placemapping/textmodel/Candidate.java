package de.julielab.jules.ae.placemapping.textmodel;

import java.util.Objects;

import org.apache.commons.lang3.Range;

/**
 * A place name candidate as delivered by one extractor for one sentence.
 * Candidates are immutable and only live during the processing of their
 * sentence.
 */
public class Candidate implements SpannedText {
    private final String text;
    private final Range<Integer> span;
    private final String sourceMethod;
    private final double baseConfidence;
    private final String documentId;
    private final String sentenceText;
    private final String beforeText;
    private final String afterText;
    private final String category;

    /**
     * @param text           the candidate text
     * @param begin          begin offset into the sentence text
     * @param end            exclusive end offset into the sentence text
     * @param sourceMethod   the name of the extractor, e.g. <tt>pattern</tt>
     * @param baseConfidence the extractor's confidence, in [0,1]
     * @param context        the sentence the candidate was found in
     * @param category       extractor specific category, e.g. the matched chain shape
     * @throws IllegalArgumentException if the offsets do not lie within the sentence or the
     *                                  confidence is out of range
     */
    public Candidate(String text, int begin, int end, String sourceMethod, double baseConfidence,
                     SentenceContext context, String category) {
        Objects.requireNonNull(text, "The candidate text must not be null");
        Objects.requireNonNull(context, "The sentence context must not be null");
        int sentenceLength = context.getSentenceText().length();
        if (begin < 0 || end <= begin || end > sentenceLength)
            throw new IllegalArgumentException("Invalid span [" + begin + ", " + end + ") for candidate '" + text
                    + "' in a sentence of length " + sentenceLength);
        if (Double.isNaN(baseConfidence) || baseConfidence < 0 || baseConfidence > 1)
            throw new IllegalArgumentException("Confidence " + baseConfidence + " of candidate '" + text
                    + "' is not in [0,1]");
        this.text = text;
        this.span = Range.between(begin, end);
        this.sourceMethod = sourceMethod;
        this.baseConfidence = baseConfidence;
        this.documentId = context.getDocumentId();
        this.sentenceText = context.getSentenceText();
        this.beforeText = context.getBeforeText();
        this.afterText = context.getAfterText();
        this.category = category;
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public Range<Integer> getSpan() {
        return span;
    }

    @Override
    public double getConfidence() {
        return baseConfidence;
    }

    public String getSourceMethod() {
        return sourceMethod;
    }

    public double getBaseConfidence() {
        return baseConfidence;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getSentenceText() {
        return sentenceText;
    }

    public String getBeforeText() {
        return beforeText;
    }

    public String getAfterText() {
        return afterText;
    }

    public String getCategory() {
        return category;
    }

    public SentenceContext getSentenceContext() {
        return new SentenceContext(documentId, sentenceText, beforeText, afterText);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Candidate candidate = (Candidate) o;
        return Double.compare(candidate.baseConfidence, baseConfidence) == 0 && text.equals(candidate.text)
                && span.equals(candidate.span) && Objects.equals(sourceMethod, candidate.sourceMethod)
                && Objects.equals(documentId, candidate.documentId) && sentenceText.equals(candidate.sentenceText)
                && Objects.equals(category, candidate.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, span, sourceMethod, baseConfidence, documentId, sentenceText, category);
    }

    @Override
    public String toString() {
        return "Candidate [text=" + text + ", span=" + span + ", sourceMethod=" + sourceMethod + ", baseConfidence="
                + baseConfidence + ", category=" + category + "]";
    }
}
