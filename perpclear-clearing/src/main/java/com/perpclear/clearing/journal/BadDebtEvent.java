package com.perpclear.clearing.journal;

import com.perpclear.core.math.Wad;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Shortfall nobody could cover: not margin, free collateral or the insurance fund.
 */
public class BadDebtEvent extends ClearingEvent {

    public enum Source {
        TRADE_LOSS,
        FUNDING,
        LIQUIDATION_PENALTY
    }

    private String token;
    private BigDecimal amount;
    private Source source;

    // For Jackson
    public BadDebtEvent() {}

    public BadDebtEvent(long venueTime, String account, String marketId, String token,
                        BigInteger amount, Source source) {
        super(venueTime, account, marketId);
        this.token = token;
        this.amount = Wad.toDecimal(amount);
        this.source = source;
    }

    @Override
    public String getEventType() { return "badDebt"; }

    @Override
    public String getSummary() {
        return String.format("[bad debt] %s %s %s %s (%s)",
                getAccount(), getMarketId(), amount.toPlainString(), token, source);
    }

    public String getToken() { return token; }
    public BigDecimal getAmount() { return amount; }
    public Source getSource() { return source; }
}
