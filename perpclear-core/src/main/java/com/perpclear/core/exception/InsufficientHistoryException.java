package com.perpclear.core.exception;

/**
 * A TWAP was requested over a window the observation history cannot cover.
 */
public class InsufficientHistoryException extends VenueException {

    private final long requestedWindow;
    private final long availableSeconds;

    public InsufficientHistoryException(String message, long requestedWindow, long availableSeconds) {
        super(message);
        this.requestedWindow = requestedWindow;
        this.availableSeconds = availableSeconds;
    }

    public long getRequestedWindow() {
        return requestedWindow;
    }

    public long getAvailableSeconds() {
        return availableSeconds;
    }
}
