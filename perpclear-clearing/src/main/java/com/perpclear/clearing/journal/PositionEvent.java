package com.perpclear.clearing.journal;

import com.perpclear.clearing.position.Position;
import com.perpclear.core.math.Wad;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Journal event for a position change caused by a trade or a liquidation.
 */
public class PositionEvent extends ClearingEvent {

    private String action; // opened, increased, reduced, closed, flipped, liquidated
    private BigDecimal size;
    private BigDecimal tradeSize;
    private BigDecimal executionPrice;
    private BigDecimal entryPrice;
    private BigDecimal margin;
    private BigDecimal realizedPnl;
    private BigDecimal tradeFee;

    // For Jackson
    public PositionEvent() {}

    public PositionEvent(long venueTime, String action, Position position, BigInteger tradeSize,
                         BigInteger executionPrice, BigInteger realizedPnl,
                         BigInteger tradeFee) {
        super(venueTime, position.getAccount(), position.getMarketId());
        this.action = action;
        this.size = Wad.toDecimal(position.getSize());
        this.tradeSize = Wad.toDecimal(tradeSize);
        this.executionPrice = Wad.toDecimal(executionPrice);
        this.entryPrice = Wad.toDecimal(position.getEntryPrice());
        this.margin = Wad.toDecimal(position.getMargin());
        this.realizedPnl = Wad.toDecimal(realizedPnl);
        this.tradeFee = Wad.toDecimal(tradeFee);
    }

    @Override
    public String getEventType() { return "position"; }

    @Override
    public String getSummary() {
        return String.format("[%s] %s %s %s @ %s size=%s pnl=%s",
                action, getAccount(), getMarketId(), tradeSize.toPlainString(),
                executionPrice.toPlainString(), size.toPlainString(), realizedPnl.toPlainString());
    }

    // Getters for Jackson
    public String getAction() { return action; }
    public BigDecimal getSize() { return size; }
    public BigDecimal getTradeSize() { return tradeSize; }
    public BigDecimal getExecutionPrice() { return executionPrice; }
    public BigDecimal getEntryPrice() { return entryPrice; }
    public BigDecimal getMargin() { return margin; }
    public BigDecimal getRealizedPnl() { return realizedPnl; }
    public BigDecimal getTradeFee() { return tradeFee; }
}
