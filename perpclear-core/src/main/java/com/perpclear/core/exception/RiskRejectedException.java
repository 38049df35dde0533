package com.perpclear.core.exception;

/**
 * Risk-policy rejection. The whole operation is rolled back.
 */
public class RiskRejectedException extends VenueException {

    private final RejectReason reason;

    public RiskRejectedException(String message, RejectReason reason) {
        super(message);
        this.reason = reason;
    }

    public RejectReason getReason() {
        return reason;
    }
}
