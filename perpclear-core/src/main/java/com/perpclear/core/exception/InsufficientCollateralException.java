package com.perpclear.core.exception;

public class InsufficientCollateralException extends RiskRejectedException {

    public InsufficientCollateralException(String message) {
        super(message, RejectReason.INSUFFICIENT_COLLATERAL);
    }
}
