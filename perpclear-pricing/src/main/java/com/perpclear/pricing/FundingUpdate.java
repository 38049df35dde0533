package com.perpclear.pricing;

import java.math.BigInteger;

/**
 * Outcome of a funding poke.
 */
public record FundingUpdate(
    long timestamp,
    long elapsedSeconds,        // capped at one hour
    BigInteger premium,         // twap - index, zero when deferred
    BigInteger rate,            // per-unit index change after clamping
    BigInteger cumulativeIndex,
    Status status
) {
    public enum Status {
        APPLIED,        // index advanced (possibly by zero)
        ALREADY_CURRENT,// poked earlier at the same timestamp
        DEFERRED        // oracle unavailable, timestamp advanced without accrual
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }
}
