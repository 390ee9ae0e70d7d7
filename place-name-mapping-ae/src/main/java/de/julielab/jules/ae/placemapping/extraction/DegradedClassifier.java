package de.julielab.jules.ae.placemapping.extraction;

import de.julielab.jules.ae.placemapping.classification.ClassificationResult;
import de.julielab.jules.ae.placemapping.knowledge.KnowledgeBase;
import de.julielab.jules.ae.placemapping.textmodel.MentionCategory;

/**
 * The fallback used when the context classifier fails for a candidate. One
 * character candidates and deny list words are non-places, everything else is
 * kept as a place with a reduced confidence.
 */
public class DegradedClassifier {
    private final KnowledgeBase knowledgeBase;
    private final double confidenceFactor;

    public DegradedClassifier(KnowledgeBase knowledgeBase, double confidenceFactor) {
        this.knowledgeBase = knowledgeBase;
        this.confidenceFactor = confidenceFactor;
    }

    /**
     * @param candidate  the candidate text
     * @param confidence the candidate's current confidence
     * @return the fallback classification; the confidence of a place result is the
     * already reduced mention confidence
     */
    public ClassificationResult classify(String candidate, double confidence) {
        MentionCategory denied = knowledgeBase.getDenyListCategory(candidate);
        if (denied != null)
            return ClassificationResult.nonPlace(confidence, denied, "fallback: deny listed as " + denied);
        if (candidate.codePointCount(0, candidate.length()) <= 1)
            return ClassificationResult.nonPlace(confidence, MentionCategory.UNKNOWN, "fallback: single character");
        return ClassificationResult.place(Math.min(1, confidence * confidenceFactor), MentionCategory.PLACE,
                "fallback: kept with reduced confidence");
    }
}
