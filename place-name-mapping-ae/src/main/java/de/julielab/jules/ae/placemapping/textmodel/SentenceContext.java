package de.julielab.jules.ae.placemapping.textmodel;

import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

/**
 * A sentence of a document together with a bounded window of the text
 * preceding and following it. The texts are expected to be free of markup and
 * ruby annotations.
 */
public class SentenceContext {
    private final String documentId;
    private final String sentenceText;
    private final String beforeText;
    private final String afterText;

    public SentenceContext(String documentId, String sentenceText) {
        this(documentId, sentenceText, "", "");
    }

    public SentenceContext(String documentId, String sentenceText, String beforeText, String afterText) {
        this.documentId = documentId;
        this.sentenceText = StringUtils.defaultString(sentenceText);
        this.beforeText = StringUtils.defaultString(beforeText);
        this.afterText = StringUtils.defaultString(afterText);
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

    /**
     * @return before text, sentence and after text concatenated
     */
    public String getFullContext() {
        return beforeText + sentenceText + afterText;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        SentenceContext that = (SentenceContext) o;
        return Objects.equals(documentId, that.documentId) && sentenceText.equals(that.sentenceText)
                && beforeText.equals(that.beforeText) && afterText.equals(that.afterText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentId, sentenceText, beforeText, afterText);
    }

    @Override
    public String toString() {
        return "SentenceContext [documentId=" + documentId + ", sentenceText=" + sentenceText + "]";
    }
}
