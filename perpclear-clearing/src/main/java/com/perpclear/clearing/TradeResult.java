package com.perpclear.clearing;

import com.perpclear.clearing.position.Position;

import java.math.BigInteger;

/**
 * Outcome of an accepted open or close.
 */
public record TradeResult(
    String account,
    String marketId,
    TradeKind kind,
    BigInteger baseDelta,       // signed, trader perspective
    BigInteger executionPrice,
    BigInteger realizedPnl,     // net of this trade's clearing fee
    BigInteger swapFee,         // charged inside the vAMM price, quote
    BigInteger tradeFee,        // clearing fee collected from free collateral
    Position position           // copy after the trade
) {}
