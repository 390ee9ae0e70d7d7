package de.julielab.jules.ae.placemapping.knowledge;

/**
 * The hierarchy levels of Japanese administrative names distinguished by the
 * extractors. Each level is defined by a {@link SuffixClass} in the suffix
 * class table.
 */
public enum SuffixLevel {
    /**
     * A county directly following a region, e.g. <tt>京都郡</tt>.
     */
    SUBREGION,
    /**
     * A town or village following a county.
     */
    COUNTY_LOCALITY,
    /**
     * A city, ward, town or village directly following a region.
     */
    LOCALITY,
    /**
     * A city that is followed by one of its wards.
     */
    CITY,
    WARD,
    /**
     * A stand-alone municipality name.
     */
    MUNICIPALITY,
    /**
     * A stand-alone county name.
     */
    COUNTY;

    public static SuffixLevel forName(String name) {
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
