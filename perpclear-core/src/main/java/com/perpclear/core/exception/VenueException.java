package com.perpclear.core.exception;

/**
 * Base type for every failure the venue reports to its callers.
 */
public class VenueException extends Exception {

    public VenueException(String message) {
        super(message);
    }

    public VenueException(String message, Throwable cause) {
        super(message, cause);
    }
}
