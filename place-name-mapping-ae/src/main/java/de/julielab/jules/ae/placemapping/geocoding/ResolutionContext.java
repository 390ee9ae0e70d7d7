package de.julielab.jules.ae.placemapping.geocoding;

/**
 * Per-mention state passed along the resolver layers.
 */
public class ResolutionContext {
    private String regionHint;

    public ResolutionContext(String regionHint) {
        this.regionHint = regionHint;
    }

    public String getRegionHint() {
        return regionHint;
    }

    public void setRegionHint(String regionHint) {
        this.regionHint = regionHint;
    }
}
