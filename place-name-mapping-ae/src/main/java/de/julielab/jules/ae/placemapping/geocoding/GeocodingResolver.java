package de.julielab.jules.ae.placemapping.geocoding;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.julielab.jules.ae.placemapping.textmodel.AcceptedMention;
import de.julielab.jules.ae.placemapping.textmodel.GeocodedRecord;

/**
 * Resolves accepted mentions to coordinates by asking its layers in order until
 * one of them answers. Mentions that were not classified as places are rejected
 * without consulting any layer. If no layer answers, a failed record is
 * returned. The returned record's confidence is the mention confidence times the
 * confidence of the answering layer.
 */
public class GeocodingResolver {
    private static final Logger log = LoggerFactory.getLogger(GeocodingResolver.class);

    private final List<ResolverLayer> layers;

    public GeocodingResolver(List<ResolverLayer> layers) {
        this.layers = List.copyOf(layers);
        log.info("Geocoding resolver layers: {}", this.layers.stream().map(ResolverLayer::getName).collect(Collectors.toList()));
    }

    public GeocodedRecord resolve(AcceptedMention mention) {
        if (!mention.isPlace()) {
            log.debug("Not resolving {}, it was classified as {}", mention.getPlaceName(), mention.getClassificationLabel());
            return GeocodedRecord.failed(mention, GeocodedRecord.SOURCE_REJECTED, null);
        }
        ResolutionContext context = new ResolutionContext(mention.getSuggestedModernRegion());
        for (ResolverLayer layer : layers) {
            Optional<GeocodedRecord> record;
            try {
                record = layer.tryResolve(mention, context);
            } catch (RuntimeException e) {
                log.warn("Resolver layer {} failed for {}; asking the next layer.", layer.getName(), mention, e);
                continue;
            }
            if (record.isPresent()) {
                log.debug("Resolved {} with layer {}: {}", mention.getPlaceName(), layer.getName(), record.get());
                return record.get();
            }
        }
        log.debug("Could not resolve {}", mention.getPlaceName());
        return GeocodedRecord.failed(mention, GeocodedRecord.SOURCE_FAILED, context.getRegionHint());
    }

    public List<ResolverLayer> getLayers() {
        return layers;
    }
}
