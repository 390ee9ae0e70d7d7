package de.julielab.jules.ae.placemapping.geocoding;

import java.util.Optional;

import de.julielab.jules.ae.placemapping.utils.GeocodingException;
import de.julielab.jules.ae.placemapping.utils.TransientGeocodingException;

/**
 * An external geocoding service. Configured implementations are created
 * reflectively and must offer a public constructor taking a
 * {@link de.julielab.jules.ae.placemapping.PlaceMappingConfiguration}.
 */
public interface ExternalGeocodingProvider {

    /**
     * @return the provider identifier, used in the resolution source of the records
     */
    String getProviderId();

    /**
     * @param placeName  the place name to look up
     * @param regionHint a region the place is expected in, may be <tt>null</tt>
     * @return the best match or empty if the provider definitely knows no such place
     * @throws TransientGeocodingException on timeouts, rate limiting and server errors
     * @throws GeocodingException          on all other errors
     */
    Optional<ProviderResult> geocode(String placeName, String regionHint) throws GeocodingException;
}
