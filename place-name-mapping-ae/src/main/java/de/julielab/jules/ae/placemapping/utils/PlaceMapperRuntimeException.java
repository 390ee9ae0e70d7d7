package de.julielab.jules.ae.placemapping.utils;

public class PlaceMapperRuntimeException extends RuntimeException {

    private static final long serialVersionUID = -2281136044619380312L;

    public PlaceMapperRuntimeException() {
    }

    public PlaceMapperRuntimeException(String message) {
        super(message);
    }

    public PlaceMapperRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }

    public PlaceMapperRuntimeException(Throwable cause) {
        super(cause);
    }

    public PlaceMapperRuntimeException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
