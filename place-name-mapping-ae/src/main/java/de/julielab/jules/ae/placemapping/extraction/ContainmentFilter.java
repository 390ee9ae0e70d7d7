package de.julielab.jules.ae.placemapping.extraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import de.julielab.jules.ae.placemapping.textmodel.SpannedText;

/**
 * Containment-based suppression within one sentence. An item is discarded if
 * its span lies within the span of a preferred item whose text contains the
 * item's text. Items with a contained span but an unrelated text are kept as
 * siblings. Longer spans are preferred, then higher confidence.
 */
public class ContainmentFilter {

    private static final Comparator<SpannedText> PREFERENCE = Comparator.comparingInt(SpannedText::getLength).reversed()
            .thenComparing(Comparator.comparingDouble(SpannedText::getConfidence).reversed())
            .thenComparingInt(SpannedText::getBegin)
            .thenComparing(SpannedText::getText);

    private static final Comparator<SpannedText> TEXT_ORDER = Comparator.comparingInt(SpannedText::getBegin)
            .thenComparing(Comparator.comparingInt(SpannedText::getLength).reversed())
            .thenComparing(SpannedText::getText);

    private ContainmentFilter() {
    }

    /**
     * @param items items of a single sentence
     * @return the surviving items ordered by begin offset, longer first
     */
    public static <T extends SpannedText> List<T> filter(List<T> items) {
        List<T> byPreference = new ArrayList<>(items);
        byPreference.sort(PREFERENCE);
        List<T> kept = new ArrayList<>();
        for (T item : byPreference) {
            if (!isSuppressed(item, kept))
                kept.add(item);
        }
        kept.sort(TEXT_ORDER);
        return kept;
    }

    private static boolean isSuppressed(SpannedText item, List<? extends SpannedText> kept) {
        for (SpannedText container : kept) {
            if (container.getSpan().containsRange(item.getSpan()) && container.getText().contains(item.getText()))
                return true;
        }
        return false;
    }
}
