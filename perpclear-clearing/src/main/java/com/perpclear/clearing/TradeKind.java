package com.perpclear.clearing;

/**
 * How a trade changed the position it was applied to.
 */
public enum TradeKind {
    OPEN,
    INCREASE,
    REDUCE,
    CLOSE,
    FLIP;

    public String action() {
        switch (this) {
            case OPEN: return "opened";
            case INCREASE: return "increased";
            case REDUCE: return "reduced";
            case CLOSE: return "closed";
            default: return "flipped";
        }
    }
}
