package com.perpclear.core.exception;

/**
 * Every price source in the fallback chain failed. Operations never proceed on a made-up price.
 */
public class PriceUnavailableException extends VenueException {

    public PriceUnavailableException(String message) {
        super(message);
    }
}
