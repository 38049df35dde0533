package com.perpclear.clearing.journal;

import com.perpclear.core.math.Wad;

import java.math.BigDecimal;
import java.math.BigInteger;

public class LiquidationEvent extends ClearingEvent {

    private String liquidator;
    private BigDecimal size;
    private BigDecimal riskPrice;
    private BigDecimal penalty;
    private BigDecimal liquidatorReward;
    private BigDecimal protocolShare;
    private BigDecimal insuranceCovered;
    private BigDecimal badDebt;

    // For Jackson
    public LiquidationEvent() {}

    public LiquidationEvent(long venueTime, String account, String marketId, String liquidator,
                            BigInteger size, BigInteger riskPrice, BigInteger penalty,
                            BigInteger liquidatorReward, BigInteger protocolShare,
                            BigInteger insuranceCovered, BigInteger badDebt) {
        super(venueTime, account, marketId);
        this.liquidator = liquidator;
        this.size = Wad.toDecimal(size);
        this.riskPrice = Wad.toDecimal(riskPrice);
        this.penalty = Wad.toDecimal(penalty);
        this.liquidatorReward = Wad.toDecimal(liquidatorReward);
        this.protocolShare = Wad.toDecimal(protocolShare);
        this.insuranceCovered = Wad.toDecimal(insuranceCovered);
        this.badDebt = Wad.toDecimal(badDebt);
    }

    @Override
    public String getEventType() { return "liquidation"; }

    @Override
    public String getSummary() {
        return String.format("[liquidation] %s %s by %s size=%s @ %s penalty=%s badDebt=%s",
                getAccount(), getMarketId(), liquidator, size.toPlainString(),
                riskPrice.toPlainString(), penalty.toPlainString(), badDebt.toPlainString());
    }

    public String getLiquidator() { return liquidator; }
    public BigDecimal getSize() { return size; }
    public BigDecimal getRiskPrice() { return riskPrice; }
    public BigDecimal getPenalty() { return penalty; }
    public BigDecimal getLiquidatorReward() { return liquidatorReward; }
    public BigDecimal getProtocolShare() { return protocolShare; }
    public BigDecimal getInsuranceCovered() { return insuranceCovered; }
    public BigDecimal getBadDebt() { return badDebt; }
}
