package de.julielab.jules.ae.placemapping.textmodel;

import org.apache.commons.lang3.Range;

/**
 * Something found at a position of a sentence. Offsets are character offsets
 * into the sentence text, the end is exclusive.
 */
public interface SpannedText {

    String getText();

    Range<Integer> getSpan();

    double getConfidence();

    default int getBegin() {
        return getSpan().getMinimum();
    }

    default int getEnd() {
        return getSpan().getMaximum();
    }

    default int getLength() {
        return getEnd() - getBegin();
    }
}
