package com.perpclear.pricing;

import java.math.BigInteger;

/**
 * One TWAP checkpoint. The cumulatives only grow while swaps are live, so the
 * difference between two observations averages over un-paused time only.
 */
public record Observation(
    long timestamp,                 // seconds
    BigInteger priceCumulative,     // sum of markPrice * seconds (wad-seconds)
    long activeSecondsCumulative    // seconds during which swaps were not paused
) {}
