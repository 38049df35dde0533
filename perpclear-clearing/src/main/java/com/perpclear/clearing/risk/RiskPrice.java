package com.perpclear.clearing.risk;

import java.math.BigInteger;

/**
 * Price used for risk decisions and where it came from.
 */
public record RiskPrice(BigInteger price, Source source) {

    public enum Source {
        ORACLE,
        TWAP,
        MARK
    }
}
