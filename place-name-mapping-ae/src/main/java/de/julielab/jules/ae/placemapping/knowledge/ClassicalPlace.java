package de.julielab.jules.ae.placemapping.knowledge;

import java.util.Collections;
import java.util.List;

/**
 * A pre-modern place or province name and the modern region it corresponds to.
 * The keywords are context words that indicate the classical use.
 */
public class ClassicalPlace {
    private final String name;
    private final String modernRegion;
    private final double latitude;
    private final double longitude;
    private final List<String> keywords;

    public ClassicalPlace(String name, String modernRegion, double latitude, double longitude, List<String> keywords) {
        this.name = name;
        this.modernRegion = modernRegion;
        this.latitude = latitude;
        this.longitude = longitude;
        this.keywords = Collections.unmodifiableList(keywords);
    }

    public String getName() {
        return name;
    }

    public String getModernRegion() {
        return modernRegion;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    /**
     * @return the first keyword contained in <tt>text</tt> or <tt>null</tt>
     */
    public String findKeyword(String text) {
        for (String keyword : keywords) {
            if (text.contains(keyword))
                return keyword;
        }
        return null;
    }

    @Override
    public String toString() {
        return "ClassicalPlace [name=" + name + ", modernRegion=" + modernRegion + "]";
    }
}
