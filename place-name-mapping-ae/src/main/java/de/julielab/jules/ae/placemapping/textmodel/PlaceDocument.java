package de.julielab.jules.ae.placemapping.textmodel;

import java.util.Collections;
import java.util.List;

/**
 * A document as a sequence of already segmented sentences.
 */
public class PlaceDocument {
    private final String documentId;
    private final List<SentenceContext> sentences;

    public PlaceDocument(String documentId, List<SentenceContext> sentences) {
        this.documentId = documentId;
        this.sentences = Collections.unmodifiableList(sentences);
    }

    public String getDocumentId() {
        return documentId;
    }

    public List<SentenceContext> getSentences() {
        return sentences;
    }

    @Override
    public String toString() {
        return "PlaceDocument [documentId=" + documentId + ", sentences=" + sentences.size() + "]";
    }
}
