package com.perpclear.clearing.journal;

import com.perpclear.core.math.Wad;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Funding settled against one position. Positive payment = received.
 */
public class FundingEvent extends ClearingEvent {

    private BigDecimal payment;
    private BigDecimal collected;
    private BigDecimal cumulativeIndex;

    // For Jackson
    public FundingEvent() {}

    public FundingEvent(long venueTime, String account, String marketId, BigInteger payment,
                        BigInteger collected, BigInteger cumulativeIndex) {
        super(venueTime, account, marketId);
        this.payment = Wad.toDecimal(payment);
        this.collected = Wad.toDecimal(collected);
        this.cumulativeIndex = Wad.toDecimal(cumulativeIndex);
    }

    @Override
    public String getEventType() { return "funding"; }

    @Override
    public String getSummary() {
        return String.format("[funding] %s %s payment=%s index=%s",
                getAccount(), getMarketId(), payment.toPlainString(), cumulativeIndex.toPlainString());
    }

    public BigDecimal getPayment() { return payment; }
    public BigDecimal getCollected() { return collected; }
    public BigDecimal getCumulativeIndex() { return cumulativeIndex; }
}
