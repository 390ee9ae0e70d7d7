package de.julielab.jules.ae.placemapping.geocoding;

import java.util.Optional;

import de.julielab.jules.ae.placemapping.textmodel.AcceptedMention;
import de.julielab.jules.ae.placemapping.textmodel.GeocodedRecord;

/**
 * One lookup layer of the {@link GeocodingResolver}. A layer either resolves
 * the mention or returns an empty result so that the next layer is asked.
 * Layers may leave hints for later layers in the {@link ResolutionContext}.
 */
public interface ResolverLayer {

    String getName();

    Optional<GeocodedRecord> tryResolve(AcceptedMention mention, ResolutionContext context);
}
