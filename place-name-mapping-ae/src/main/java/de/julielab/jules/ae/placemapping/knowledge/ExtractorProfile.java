package de.julielab.jules.ae.placemapping.knowledge;

/**
 * The static trust profile of one extraction source. A lower priority number is
 * preferred; the source with the lowest number is the highest-trust source.
 */
public class ExtractorProfile {
    private final String source;
    private final int priority;
    private final double baseReliability;
    private final double trustThreshold;

    public ExtractorProfile(String source, int priority, double baseReliability, double trustThreshold) {
        this.source = source;
        this.priority = priority;
        this.baseReliability = baseReliability;
        this.trustThreshold = trustThreshold;
    }

    public String getSource() {
        return source;
    }

    public int getPriority() {
        return priority;
    }

    public double getBaseReliability() {
        return baseReliability;
    }

    /**
     * @return the minimum confidence a mention of this source needs to be kept
     */
    public double getTrustThreshold() {
        return trustThreshold;
    }

    @Override
    public String toString() {
        return "ExtractorProfile [source=" + source + ", priority=" + priority + ", baseReliability="
                + baseReliability + ", trustThreshold=" + trustThreshold + "]";
    }
}
