package com.perpclear.clearing.port;

import com.perpclear.core.exception.CollateralException;

import java.math.BigInteger;

/**
 * Backstop for liquidation shortfalls. Amounts in native token units.
 */
public interface InsuranceFund {

    /** Ledger account holding the fund's collateral. */
    String accountId();

    BigInteger balance(String token);

    /**
     * Pay up to {@code amount} to {@code to}. Returns what was actually paid.
     */
    BigInteger payout(String to, String token, BigInteger amount) throws CollateralException;
}
