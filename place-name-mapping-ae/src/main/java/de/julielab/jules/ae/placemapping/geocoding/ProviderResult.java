package de.julielab.jules.ae.placemapping.geocoding;

public class ProviderResult {
    private final double latitude;
    private final double longitude;
    private final double confidence;
    private final String displayName;

    public ProviderResult(double latitude, double longitude, double confidence, String displayName) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.confidence = Math.max(0, Math.min(1, confidence));
        this.displayName = displayName;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    /**
     * @return the provider's own confidence in the match, in [0,1]
     */
    public double getConfidence() {
        return confidence;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return "ProviderResult [latitude=" + latitude + ", longitude=" + longitude + ", confidence=" + confidence
                + ", displayName=" + displayName + "]";
    }
}
