package de.julielab.jules.ae.placemapping.textmodel;

import java.util.HashMap;
import java.util.Map;

/**
 * The classification labels of a mention. Only the place type labels are
 * passed on to geocoding.
 */
public enum MentionCategory {
    PLACE("place", true),
    HISTORICAL_PROVINCE("historical_province", true),
    PERSON("person", false),
    PLANT("plant", false),
    DIRECTION("direction", false),
    BUILDING_PART("building_part", false),
    GENERIC_NOUN("generic_noun", false),
    UNKNOWN("unknown", false);

    private static final Map<String, MentionCategory> BY_LABEL = new HashMap<>();

    static {
        for (MentionCategory category : values())
            BY_LABEL.put(category.label, category);
    }

    private final String label;
    private final boolean placeType;

    MentionCategory(String label, boolean placeType) {
        this.label = label;
        this.placeType = placeType;
    }

    /**
     * @param label a label as written in the knowledge tables, e.g. <tt>building_part</tt>
     * @return the category or <tt>null</tt> if the label is unknown
     */
    public static MentionCategory forLabel(String label) {
        return label == null ? null : BY_LABEL.get(label.trim().toLowerCase());
    }

    public String getLabel() {
        return label;
    }

    public boolean isPlaceType() {
        return placeType;
    }

    @Override
    public String toString() {
        return label;
    }
}
