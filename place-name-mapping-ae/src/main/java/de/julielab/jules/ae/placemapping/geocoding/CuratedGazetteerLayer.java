package de.julielab.jules.ae.placemapping.geocoding;

import java.util.Optional;

import de.julielab.jules.ae.placemapping.knowledge.Gazetteer;
import de.julielab.jules.ae.placemapping.knowledge.GazetteerEntry;
import de.julielab.jules.ae.placemapping.textmodel.AcceptedMention;
import de.julielab.jules.ae.placemapping.textmodel.GeocodedRecord;
import de.julielab.jules.ae.placemapping.utils.norm.PlaceNameNormalizer;

/**
 * Exact lookup in one hand-curated gazetteer. The gazetteer identifier is the
 * resolution source.
 */
public class CuratedGazetteerLayer implements ResolverLayer {
    private final Gazetteer gazetteer;
    private final PlaceNameNormalizer normalizer;

    public CuratedGazetteerLayer(Gazetteer gazetteer, PlaceNameNormalizer normalizer) {
        this.gazetteer = gazetteer;
        this.normalizer = normalizer;
    }

    @Override
    public String getName() {
        return gazetteer.getId();
    }

    @Override
    public Optional<GeocodedRecord> tryResolve(AcceptedMention mention, ResolutionContext context) {
        GazetteerEntry entry = gazetteer.lookup(mention.getPlaceName());
        if (entry == null)
            entry = gazetteer.lookup(normalizer.normalize(mention.getPlaceName()));
        if (entry == null)
            return Optional.empty();
        return Optional.of(new GeocodedRecord(mention, entry.getName(), entry.getLatitude(), entry.getLongitude(),
                gazetteer.getConfidence(), gazetteer.getId(), entry.getRegion(), mention.getSentenceText()));
    }
}
