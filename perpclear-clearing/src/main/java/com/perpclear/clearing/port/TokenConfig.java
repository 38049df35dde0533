package com.perpclear.clearing.port;

import java.math.BigInteger;

public record TokenConfig(
    String symbol,
    BigInteger baseUnit,    // 10^decimals
    boolean enabled
) {
    public static TokenConfig ofDecimals(String symbol, int decimals, boolean enabled) {
        return new TokenConfig(symbol, BigInteger.TEN.pow(decimals), enabled);
    }
}
