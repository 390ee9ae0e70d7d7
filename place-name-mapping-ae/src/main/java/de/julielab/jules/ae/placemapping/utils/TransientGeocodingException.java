package de.julielab.jules.ae.placemapping.utils;

/**
 * Timeouts, rate limit responses and server side errors of a geocoding provider.
 * These are retried with backoff.
 */
public class TransientGeocodingException extends GeocodingException {

    private static final long serialVersionUID = 3018847756120413327L;

    public TransientGeocodingException() {
    }

    public TransientGeocodingException(String message) {
        super(message);
    }

    public TransientGeocodingException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransientGeocodingException(Throwable cause) {
        super(cause);
    }

    public TransientGeocodingException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
