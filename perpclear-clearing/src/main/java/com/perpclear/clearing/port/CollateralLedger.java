package com.perpclear.clearing.port;

import com.perpclear.core.exception.CollateralException;

import java.math.BigInteger;

/**
 * Collateral custody. Amounts are in each token's native units.
 */
public interface CollateralLedger {

    BigInteger balanceOf(String account, String token);

    BigInteger deposit(String account, String token, BigInteger amount) throws CollateralException;

    BigInteger withdraw(String account, String token, BigInteger amount) throws CollateralException;

    void seize(String from, String to, String token, BigInteger amount) throws CollateralException;

    /** Credit (positive) or debit (negative) realized PnL / funding against a balance. */
    void settlePnL(String account, String token, BigInteger signedAmount) throws CollateralException;

    /** Total value of the account's enabled collateral, 1e18 scaled. */
    BigInteger accountCollateralValue(String account);

    /** Null when the token is unknown. */
    TokenConfig tokenConfig(String token);
}
