package com.perpclear.clearing.port;

import com.perpclear.core.oracle.IndexPriceSource;
import com.perpclear.pricing.VirtualAmm;

import java.math.BigInteger;

/**
 * Directory entry for one perpetual market.
 */
public record MarketInfo(
    String marketId,
    VirtualAmm amm,
    IndexPriceSource oracle,
    int feeBps,                 // clearing trade fee on notional
    FeeDistributor feeRouter,
    InsuranceFund insuranceFund,
    String quoteToken,
    String baseToken,
    BigInteger baseUnit,
    boolean paused
) {
    public MarketInfo withPaused(boolean paused) {
        return new MarketInfo(marketId, amm, oracle, feeBps, feeRouter, insuranceFund,
                quoteToken, baseToken, baseUnit, paused);
    }
}
