package de.julielab.jules.ae.placemapping.geocoding;

import java.util.Optional;

import de.julielab.jules.ae.placemapping.knowledge.ClassicalPlace;
import de.julielab.jules.ae.placemapping.knowledge.KnowledgeBase;
import de.julielab.jules.ae.placemapping.textmodel.AcceptedMention;
import de.julielab.jules.ae.placemapping.textmodel.GeocodedRecord;
import de.julielab.jules.ae.placemapping.textmodel.MentionCategory;
import de.julielab.jules.ae.placemapping.utils.norm.PlaceNameNormalizer;

/**
 * Maps classical place and province names to the coordinates of their modern
 * equivalent region. Applies to mentions classified as historical provinces and
 * to classical names whose context keywords occur in the mention's sentence.
 */
public class ClassicalPlaceLayer implements ResolverLayer {
    public static final String SOURCE = "classical";

    private final KnowledgeBase knowledgeBase;
    private final PlaceNameNormalizer normalizer;
    private final double confidence;

    public ClassicalPlaceLayer(KnowledgeBase knowledgeBase, PlaceNameNormalizer normalizer, double confidence) {
        this.knowledgeBase = knowledgeBase;
        this.normalizer = normalizer;
        this.confidence = confidence;
    }

    @Override
    public String getName() {
        return SOURCE;
    }

    @Override
    public Optional<GeocodedRecord> tryResolve(AcceptedMention mention, ResolutionContext context) {
        String name = mention.getPlaceName();
        ClassicalPlace place = knowledgeBase.getClassicalPlace(name);
        if (place == null)
            place = knowledgeBase.getClassicalPlace(normalizer.stripProvinceMarker(name));
        if (place == null)
            return Optional.empty();
        boolean historical = mention.getClassificationLabel() == MentionCategory.HISTORICAL_PROVINCE
                || place.findKeyword(mention.getSentenceContext().getFullContext()) != null;
        if (!historical)
            return Optional.empty();
        return Optional.of(new GeocodedRecord(mention, place.getModernRegion(), place.getLatitude(),
                place.getLongitude(), confidence, SOURCE, place.getModernRegion(), mention.getSentenceText()));
    }
}
