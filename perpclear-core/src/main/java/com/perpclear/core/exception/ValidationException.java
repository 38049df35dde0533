package com.perpclear.core.exception;

/**
 * Structural rejection: bad input, unknown market, parameters not configured.
 * Raised before any state is touched.
 */
public class ValidationException extends VenueException {

    private final RejectReason reason;

    public ValidationException(String message, RejectReason reason) {
        super(message);
        this.reason = reason;
    }

    public RejectReason getReason() {
        return reason;
    }
}
