package de.julielab.jules.ae.placemapping.textmodel;

import org.apache.commons.lang3.Range;

/**
 * The geocoding outcome for one accepted mention. Records are keyed by document
 * ID, place name and span. If resolution failed, latitude and longitude are
 * <tt>null</tt> and the confidence is 0.
 */
public class GeocodedRecord {
    /**
     * Resolution source of mentions that were not classified as places.
     */
    public static final String SOURCE_REJECTED = "context_rejected";
    /**
     * Resolution source of mentions no lookup layer could resolve.
     */
    public static final String SOURCE_FAILED = "failed";

    private final String documentId;
    private final String placeName;
    private final Range<Integer> span;
    private final String canonicalName;
    private final Double latitude;
    private final Double longitude;
    private final double confidence;
    private final double layerConfidence;
    private final String resolutionSource;
    private final String regionHint;
    private final String representativeContext;

    /**
     * @param mention               the resolved mention
     * @param canonicalName         the name of the place the coordinates belong to
     * @param latitude              latitude or <tt>null</tt>
     * @param longitude             longitude or <tt>null</tt>
     * @param layerConfidence       the confidence of the lookup layer that produced the coordinates
     * @param resolutionSource      the identifier of the lookup layer
     * @param regionHint            the region used to resolve the name, may be <tt>null</tt>
     * @param representativeContext the sentence the coordinates were first resolved for
     */
    public GeocodedRecord(AcceptedMention mention, String canonicalName, Double latitude, Double longitude,
                          double layerConfidence, String resolutionSource, String regionHint,
                          String representativeContext) {
        this.documentId = mention.getDocumentId();
        this.placeName = mention.getPlaceName();
        this.span = mention.getSpan();
        this.canonicalName = canonicalName;
        this.latitude = latitude;
        this.longitude = longitude;
        this.layerConfidence = layerConfidence;
        this.resolutionSource = resolutionSource;
        this.regionHint = regionHint;
        this.representativeContext = representativeContext;
        double product = latitude == null ? 0 : mention.getConfidence() * layerConfidence;
        this.confidence = Math.max(0, Math.min(1, product));
    }

    public static GeocodedRecord failed(AcceptedMention mention, String resolutionSource, String regionHint) {
        return new GeocodedRecord(mention, null, null, null, 0, resolutionSource, regionHint,
                mention.getSentenceText());
    }

    public boolean isResolved() {
        return latitude != null && longitude != null;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getPlaceName() {
        return placeName;
    }

    public Range<Integer> getSpan() {
        return span;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public Double getLatitude() {
        return latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    /**
     * @return mention confidence times layer confidence, clamped to [0,1]
     */
    public double getConfidence() {
        return confidence;
    }

    public double getLayerConfidence() {
        return layerConfidence;
    }

    public String getResolutionSource() {
        return resolutionSource;
    }

    public String getRegionHint() {
        return regionHint;
    }

    public String getRepresentativeContext() {
        return representativeContext;
    }

    @Override
    public String toString() {
        return "GeocodedRecord [placeName=" + placeName + ", canonicalName=" + canonicalName + ", latitude="
                + latitude + ", longitude=" + longitude + ", confidence=" + confidence + ", resolutionSource="
                + resolutionSource + ", regionHint=" + regionHint + "]";
    }
}
