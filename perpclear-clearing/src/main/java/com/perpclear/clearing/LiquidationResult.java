package com.perpclear.clearing;

import com.perpclear.clearing.position.Position;
import com.perpclear.clearing.risk.RiskPrice;

import java.math.BigInteger;

/**
 * Outcome of a liquidation. Penalty amounts are quote wads; {@code badDebt} is the part of the
 * penalty nobody covered.
 */
public record LiquidationResult(
    String account,
    String liquidator,
    String marketId,
    BigInteger size,
    RiskPrice riskPrice,        // snapshot taken before the closing trade
    BigInteger executionPrice,
    BigInteger realizedPnl,
    BigInteger penalty,
    BigInteger liquidatorReward,
    BigInteger protocolShare,
    BigInteger insuranceCovered,
    BigInteger badDebt,
    Position position
) {
    public BigInteger remainingSize() {
        return position.getSize().abs();
    }
}
