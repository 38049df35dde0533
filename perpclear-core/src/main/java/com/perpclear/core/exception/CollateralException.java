package com.perpclear.core.exception;

/**
 * A collateral-side collaborator (ledger, insurance fund) refused or failed a request.
 */
public class CollateralException extends VenueException {

    public CollateralException(String message) {
        super(message);
    }

    public CollateralException(String message, Throwable cause) {
        super(message, cause);
    }
}
