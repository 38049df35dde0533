package com.perpclear.core.exception;

public class AccessDeniedException extends VenueException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
