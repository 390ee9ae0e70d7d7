package de.julielab.jules.ae.placemapping.extraction;

import java.util.List;

import de.julielab.jules.ae.placemapping.utils.ExtractionException;

/**
 * A black box named entity recognizer delivering place-like entities.
 * Configured implementations are created reflectively and must offer a public
 * constructor taking a
 * {@link de.julielab.jules.ae.placemapping.PlaceMappingConfiguration}.
 */
public interface ExternalNERSource {
    List<NamedEntitySpan> extract(String documentId, String sentenceText) throws ExtractionException;
}
