package de.julielab.jules.ae.placemapping.utils;

/**
 * Thrown by an extractor that cannot process a sentence. The coordinator treats
 * the candidates of the failing extractor as empty for that sentence.
 */
public class ExtractionException extends PlaceMappingException {

    private static final long serialVersionUID = 7129835561308826514L;

    public ExtractionException() {
    }

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    public ExtractionException(Throwable cause) {
        super(cause);
    }

    public ExtractionException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
