package com.perpclear.core.exception;

import java.math.BigInteger;

public class SlippageExceededException extends VenueException {

    private final BigInteger averagePrice;
    private final BigInteger priceLimit;

    public SlippageExceededException(String message, BigInteger averagePrice, BigInteger priceLimit) {
        super(message);
        this.averagePrice = averagePrice;
        this.priceLimit = priceLimit;
    }

    public BigInteger getAveragePrice() {
        return averagePrice;
    }

    public BigInteger getPriceLimit() {
        return priceLimit;
    }
}
