package de.julielab.jules.ae.placemapping.extraction;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.julielab.jules.ae.placemapping.knowledge.ExtractorProfile;
import de.julielab.jules.ae.placemapping.textmodel.Candidate;
import de.julielab.jules.ae.placemapping.textmodel.SentenceContext;
import de.julielab.jules.ae.placemapping.utils.ExtractionException;

/**
 * Turns the entities of an {@link ExternalNERSource} into candidates. The
 * recognizer reports no confidence, so every candidate gets the base
 * reliability of the <tt>ner</tt> extractor profile. Entities with offsets
 * outside of the sentence are dropped.
 */
public class NerPlaceExtractor implements PlaceExtractor {
    public static final String SOURCE_METHOD = "ner";
    private static final Logger log = LoggerFactory.getLogger(NerPlaceExtractor.class);

    private final ExternalNERSource nerSource;
    private final double baseConfidence;

    public NerPlaceExtractor(ExternalNERSource nerSource, ExtractorProfile profile) {
        this.nerSource = nerSource;
        this.baseConfidence = profile.getBaseReliability();
    }

    @Override
    public String getSourceMethod() {
        return SOURCE_METHOD;
    }

    @Override
    public List<Candidate> extract(SentenceContext context) throws ExtractionException {
        List<NamedEntitySpan> entities = nerSource.extract(context.getDocumentId(), context.getSentenceText());
        if (entities == null)
            return List.of();
        int length = context.getSentenceText().length();
        List<Candidate> candidates = new ArrayList<>(entities.size());
        for (NamedEntitySpan entity : entities) {
            if (entity.getText() == null || entity.getText().isBlank() || entity.getBegin() < 0
                    || entity.getEnd() <= entity.getBegin() || entity.getEnd() > length) {
                log.debug("Dropping entity {} with invalid offsets for a sentence of length {}", entity, length);
                continue;
            }
            candidates.add(new Candidate(entity.getText(), entity.getBegin(), entity.getEnd(), SOURCE_METHOD,
                    baseConfidence, context, SOURCE_METHOD));
        }
        return candidates;
    }
}
