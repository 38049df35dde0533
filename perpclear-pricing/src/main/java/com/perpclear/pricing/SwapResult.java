package com.perpclear.pricing;

import java.math.BigInteger;

/**
 * Result of a swap against the virtual reserves, signed from the trader's side:
 * a buy has baseDelta > 0 and quoteDelta < 0, a sell the reverse.
 */
public record SwapResult(
    BigInteger baseDelta,
    BigInteger quoteDelta,
    BigInteger averagePrice,    // gross quote / base, rounded up
    BigInteger fee              // quote value retained as swap fee
) {
    public boolean isBuy() {
        return baseDelta.signum() > 0;
    }

    public BigInteger baseAmount() {
        return baseDelta.abs();
    }

    public BigInteger quoteAmount() {
        return quoteDelta.abs();
    }
}
