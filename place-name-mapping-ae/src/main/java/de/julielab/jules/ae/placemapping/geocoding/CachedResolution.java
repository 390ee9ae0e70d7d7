package de.julielab.jules.ae.placemapping.geocoding;

/**
 * A cached provider outcome together with the sentence it was first requested
 * for. A <tt>null</tt> result is a cached "not found".
 */
public class CachedResolution {
    private final ProviderResult result;
    private final String representativeContext;

    public CachedResolution(ProviderResult result, String representativeContext) {
        this.result = result;
        this.representativeContext = representativeContext;
    }

    public ProviderResult getResult() {
        return result;
    }

    public boolean isFound() {
        return result != null;
    }

    public String getRepresentativeContext() {
        return representativeContext;
    }
}
