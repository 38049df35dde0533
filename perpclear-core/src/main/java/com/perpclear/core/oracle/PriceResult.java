package com.perpclear.core.oracle;

import java.math.BigInteger;

/**
 * Outcome of a price-source read. A failed read carries a reason instead of a price;
 * a zero price is reported as unavailable rather than as a valid quote.
 */
public record PriceResult(
    BigInteger price,       // 1e18 scaled, null when failed
    String failure          // null when available
) {
    public static PriceResult of(BigInteger price) {
        if (price == null || price.signum() <= 0) {
            return failed("non-positive price: " + price);
        }
        return new PriceResult(price, null);
    }

    public static PriceResult failed(String reason) {
        return new PriceResult(null, reason);
    }

    public boolean isAvailable() {
        return price != null && price.signum() > 0;
    }
}
