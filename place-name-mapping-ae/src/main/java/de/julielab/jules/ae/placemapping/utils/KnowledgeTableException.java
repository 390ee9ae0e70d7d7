package de.julielab.jules.ae.placemapping.utils;

/**
 * A knowledge table is missing, unreadable, malformed or empty. Raised while
 * loading the tables; the mapping cannot be used without them.
 */
public class KnowledgeTableException extends PlaceMappingException {

    private static final long serialVersionUID = -902635412897551031L;

    public KnowledgeTableException() {
    }

    public KnowledgeTableException(String message) {
        super(message);
    }

    public KnowledgeTableException(String message, Throwable cause) {
        super(message, cause);
    }

    public KnowledgeTableException(Throwable cause) {
        super(cause);
    }

    public KnowledgeTableException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
