package de.julielab.jules.ae.placemapping.utils;

/**
 * A geocoding provider error that will not go away by asking again, e.g. a
 * malformed request. Errors that might disappear on retry are
 * {@link TransientGeocodingException}s.
 */
public class GeocodingException extends PlaceMappingException {

    private static final long serialVersionUID = 8813265405530172206L;

    public GeocodingException() {
    }

    public GeocodingException(String message) {
        super(message);
    }

    public GeocodingException(String message, Throwable cause) {
        super(message, cause);
    }

    public GeocodingException(Throwable cause) {
        super(cause);
    }

    public GeocodingException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
