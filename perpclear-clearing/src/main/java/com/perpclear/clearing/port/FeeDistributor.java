package com.perpclear.clearing.port;

import com.perpclear.core.exception.CollateralException;

import java.math.BigInteger;

/**
 * Receives trade fees and the protocol share of liquidation penalties.
 * The clearing engine moves the tokens into {@link #accountId()} first, then notifies.
 */
public interface FeeDistributor {

    String accountId();

    void onTradeFee(String token, BigInteger amount) throws CollateralException;

    void onLiquidationPenalty(String token, BigInteger amount) throws CollateralException;
}
