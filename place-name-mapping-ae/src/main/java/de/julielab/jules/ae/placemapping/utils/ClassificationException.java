package de.julielab.jules.ae.placemapping.utils;

public class ClassificationException extends PlaceMappingException {

    private static final long serialVersionUID = -6340817920417525183L;

    public ClassificationException() {
    }

    public ClassificationException(String message) {
        super(message);
    }

    public ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ClassificationException(Throwable cause) {
        super(cause);
    }

    public ClassificationException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
