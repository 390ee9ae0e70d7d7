package de.julielab.jules.ae.placemapping.geocoding;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.julielab.jules.ae.placemapping.knowledge.AmbiguousName;
import de.julielab.jules.ae.placemapping.knowledge.KnowledgeBase;
import de.julielab.jules.ae.placemapping.textmodel.AcceptedMention;
import de.julielab.jules.ae.placemapping.textmodel.GeocodedRecord;

/**
 * Never resolves anything. For an ambiguous name that was accepted as a place,
 * the modern place of the ambiguous name table becomes the region hint of the
 * external lookup.
 */
public class AmbiguousNameHintLayer implements ResolverLayer {
    private static final Logger log = LoggerFactory.getLogger(AmbiguousNameHintLayer.class);

    private final KnowledgeBase knowledgeBase;

    public AmbiguousNameHintLayer(KnowledgeBase knowledgeBase) {
        this.knowledgeBase = knowledgeBase;
    }

    @Override
    public String getName() {
        return "ambiguous_name_hint";
    }

    @Override
    public Optional<GeocodedRecord> tryResolve(AcceptedMention mention, ResolutionContext context) {
        AmbiguousName ambiguousName = knowledgeBase.getAmbiguousName(mention.getPlaceName());
        if (ambiguousName != null && mention.isPlace() && ambiguousName.getModernPlace() != null) {
            log.debug("Using {} as region hint for the ambiguous name {}", ambiguousName.getModernPlace(),
                    mention.getPlaceName());
            context.setRegionHint(ambiguousName.getModernPlace());
        }
        return Optional.empty();
    }
}
