package de.julielab.jules.ae.placemapping.knowledge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A hand-curated, region specific table of place coordinates. The identifier
 * is reported as the resolution source of every name resolved by this
 * gazetteer.
 */
public class Gazetteer {
    private final String id;
    private final double confidence;
    private final Map<String, GazetteerEntry> entries;

    public Gazetteer(String id, double confidence, Map<String, GazetteerEntry> entries) {
        this.id = id;
        this.confidence = confidence;
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public String getId() {
        return id;
    }

    public double getConfidence() {
        return confidence;
    }

    public GazetteerEntry lookup(String name) {
        return entries.get(name);
    }

    public Map<String, GazetteerEntry> getEntries() {
        return entries;
    }

    @Override
    public String toString() {
        return "Gazetteer [id=" + id + ", confidence=" + confidence + ", entries=" + entries.size() + "]";
    }
}
