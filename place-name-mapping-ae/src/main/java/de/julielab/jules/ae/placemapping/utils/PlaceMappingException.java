package de.julielab.jules.ae.placemapping.utils;

public class PlaceMappingException extends Exception {

    private static final long serialVersionUID = 4519020187763524097L;

    public PlaceMappingException() {
    }

    public PlaceMappingException(String message) {
        super(message);
    }

    public PlaceMappingException(String message, Throwable cause) {
        super(message, cause);
    }

    public PlaceMappingException(Throwable cause) {
        super(cause);
    }

    public PlaceMappingException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
