package com.perpclear.clearing.risk;

import com.perpclear.core.config.VenueConfig;
import com.perpclear.core.exception.RejectReason;
import com.perpclear.core.exception.ValidationException;
import com.perpclear.core.math.Wad;

import java.math.BigInteger;

/**
 * Per-market margin and liquidation parameters. Size and cap fields are 1e18 fixed point,
 * zero meaning unbounded.
 */
public record MarketRiskParams(
    int imrBps,
    int mmrBps,
    int liquidationPenaltyBps,
    BigInteger penaltyCap,
    int liquidatorShareBps,
    BigInteger maxPositionSize,
    BigInteger minPositionSize
) {
    public static MarketRiskParams fromConfig(VenueConfig.RiskConfig config) {
        return new MarketRiskParams(
                config.getImrBps(),
                config.getMmrBps(),
                config.getLiquidationPenaltyBps(),
                Wad.parse(config.getPenaltyCap()),
                config.getLiquidatorShareBps(),
                Wad.parse(config.getMaxPositionSize()),
                Wad.parse(config.getMinPositionSize())
        );
    }

    public static MarketRiskParams defaults() {
        return new MarketRiskParams(1000, 500, 250, BigInteger.ZERO, 5000, BigInteger.ZERO, BigInteger.ZERO);
    }

    public void validate() throws ValidationException {
        if (mmrBps <= 0 || imrBps < mmrBps || imrBps > 10_000) {
            throw new ValidationException(String.format("Margin requirements must satisfy 10000 >= imr (%d) >= mmr (%d) > 0",
                    imrBps, mmrBps), RejectReason.INVALID_PARAMS);
        }
        if (liquidationPenaltyBps < 0 || liquidationPenaltyBps > 10_000
                || liquidatorShareBps < 0 || liquidatorShareBps > 10_000) {
            throw new ValidationException("Penalty and liquidator share must be within [0, 10000] bps",
                    RejectReason.INVALID_PARAMS);
        }
        if (penaltyCap.signum() < 0 || maxPositionSize.signum() < 0 || minPositionSize.signum() < 0) {
            throw new ValidationException("Caps and size bounds cannot be negative", RejectReason.INVALID_PARAMS);
        }
        if (maxPositionSize.signum() > 0 && minPositionSize.compareTo(maxPositionSize) > 0) {
            throw new ValidationException("minPositionSize above maxPositionSize", RejectReason.INVALID_PARAMS);
        }
    }

    public BigInteger initialMargin(BigInteger notional) {
        return Wad.bps(notional, imrBps, true);
    }

    public BigInteger maintenanceMargin(BigInteger notional) {
        return Wad.bps(notional, mmrBps, true);
    }

    /** Penalty on the liquidated notional, capped when a cap is set. */
    public BigInteger penalty(BigInteger notional) {
        BigInteger penalty = Wad.bps(notional, liquidationPenaltyBps, true);
        return penaltyCap.signum() > 0 ? penalty.min(penaltyCap) : penalty;
    }
}
