package de.julielab.jules.ae.placemapping.geocoding;

import java.util.Objects;

/**
 * Key of the {@link GeocodingCache}: a normalized place name and the region
 * hint the provider was asked with. The hint may be <tt>null</tt>.
 */
public class ResolutionCacheKey {
    private final String normalizedName;
    private final String regionHint;

    public ResolutionCacheKey(String normalizedName, String regionHint) {
        this.normalizedName = normalizedName;
        this.regionHint = regionHint;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public String getRegionHint() {
        return regionHint;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        ResolutionCacheKey that = (ResolutionCacheKey) o;
        return Objects.equals(normalizedName, that.normalizedName) && Objects.equals(regionHint, that.regionHint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(normalizedName, regionHint);
    }

    @Override
    public String toString() {
        return regionHint == null ? normalizedName : normalizedName + " (" + regionHint + ")";
    }
}
