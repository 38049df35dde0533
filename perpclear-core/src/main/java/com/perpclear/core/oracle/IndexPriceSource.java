package com.perpclear.core.oracle;

/**
 * External reference (index) price for a market.
 * Implementations must not throw; failures are reported through {@link PriceResult}.
 */
@FunctionalInterface
public interface IndexPriceSource {

    PriceResult getPrice();
}
