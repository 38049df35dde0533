package com.perpclear.core.exception;

/**
 * Machine-readable reason attached to validation and risk-policy rejections.
 */
public enum RejectReason {
    // Validation / structural
    ZERO_AMOUNT,
    UNKNOWN_MARKET,
    MARKET_INACTIVE,
    RISK_PARAMS_NOT_SET,
    INVALID_PARAMS,
    SIZE_ABOVE_MAX,
    SIZE_BELOW_MIN,
    DUST_REMAINDER,
    NO_POSITION,
    CLOSE_EXCEEDS_POSITION,
    TOO_MANY_MARKETS,
    SELF_LIQUIDATION,
    UNKNOWN_TOKEN,
    SWAPS_PAUSED,
    RESERVE_FLOOR,
    PRICE_MOVE_TOO_LARGE,
    FEE_TOO_HIGH,

    // Risk policy
    INSUFFICIENT_COLLATERAL,
    IMR_BREACH,
    WOULD_BE_LIQUIDATABLE,
    ACCOUNT_LIQUIDATABLE,
    NOT_LIQUIDATABLE,
    MAINTENANCE_BREACH,
    WITHDRAW_UNBACKED
}
