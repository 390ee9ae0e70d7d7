package de.julielab.jules.ae.placemapping.extraction;

import java.util.List;

import de.julielab.jules.ae.placemapping.textmodel.Candidate;
import de.julielab.jules.ae.placemapping.textmodel.SentenceContext;
import de.julielab.jules.ae.placemapping.utils.ExtractionException;

/**
 * An extraction strategy. Implementations must be thread safe; the
 * {@link ExtractionCoordinator} calls them concurrently for different sentences.
 */
public interface PlaceExtractor {

    /**
     * @return the name of this source, used as the candidates' source method and
     * as the key of the extractor profile
     */
    String getSourceMethod();

    List<Candidate> extract(SentenceContext context) throws ExtractionException;
}
