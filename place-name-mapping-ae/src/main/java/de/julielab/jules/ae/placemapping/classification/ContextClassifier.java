package de.julielab.jules.ae.placemapping.classification;

import de.julielab.jules.ae.placemapping.textmodel.SentenceContext;
import de.julielab.jules.ae.placemapping.utils.ClassificationException;

/**
 * Decides whether a candidate string functions as a place name in its sentence
 * and, if it does not, what it more likely is.
 */
public interface ContextClassifier {
    ClassificationResult classify(String candidate, SentenceContext context) throws ClassificationException;
}
