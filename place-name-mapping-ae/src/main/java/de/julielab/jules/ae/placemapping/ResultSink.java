package de.julielab.jules.ae.placemapping;

import de.julielab.jules.ae.placemapping.textmodel.DocumentMappingResult;
import de.julielab.jules.ae.placemapping.utils.PlaceMappingException;

/**
 * Persists the results of the mapping. Each call to {@link #commit} must store
 * the complete result of one document or nothing of it. Implementations are
 * called from several worker threads concurrently.
 */
public interface ResultSink {
    void commit(DocumentMappingResult result) throws PlaceMappingException;
}
