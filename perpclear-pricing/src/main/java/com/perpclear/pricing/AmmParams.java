package com.perpclear.pricing;

import com.perpclear.core.config.VenueConfig;
import com.perpclear.core.math.Wad;

import java.math.BigInteger;

/**
 * Construction parameters for a {@link VirtualAmm}.
 */
public record AmmParams(
    BigInteger initialPrice,        // wad
    BigInteger baseReserve,         // wad
    int feeBps,                     // input-side swap fee, at most 300
    int frMaxBpsPerHour,            // funding clamp, bps of index per hour
    BigInteger fundingK,            // wad multiplier on the premium
    long observationWindow,         // seconds, TWAP window used for funding
    int observationCardinality,
    BigInteger minReserveBase,
    BigInteger minReserveQuote
) {
    public static AmmParams fromConfig(VenueConfig.AmmConfig config) {
        return new AmmParams(
                Wad.parse(config.getInitialPrice()),
                Wad.parse(config.getBaseReserve()),
                config.getFeeBps(),
                config.getFrMaxBpsPerHour(),
                Wad.parse(config.getFundingK()),
                config.getObservationWindow(),
                config.getObservationCardinality(),
                Wad.parse(config.getMinReserveBase()),
                Wad.parse(config.getMinReserveQuote())
        );
    }

    public static AmmParams defaults(BigInteger initialPrice, BigInteger baseReserve) {
        return new AmmParams(initialPrice, baseReserve, 10, 100, Wad.ONE, 900, 64,
                Wad.ONE, Wad.ONE);
    }

    public AmmParams withFeeBps(int bps) {
        return new AmmParams(initialPrice, baseReserve, bps, frMaxBpsPerHour, fundingK,
                observationWindow, observationCardinality, minReserveBase, minReserveQuote);
    }

    public AmmParams withFunding(int maxBpsPerHour, BigInteger k, long window) {
        return new AmmParams(initialPrice, baseReserve, feeBps, maxBpsPerHour, k,
                window, observationCardinality, minReserveBase, minReserveQuote);
    }

    public AmmParams withObservationCardinality(int cardinality) {
        return new AmmParams(initialPrice, baseReserve, feeBps, frMaxBpsPerHour, fundingK,
                observationWindow, cardinality, minReserveBase, minReserveQuote);
    }
}
