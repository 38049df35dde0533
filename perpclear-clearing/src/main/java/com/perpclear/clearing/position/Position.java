package com.perpclear.clearing.position;

import com.perpclear.core.math.Wad;

import java.math.BigInteger;

/**
 * Perpetual position of one account in one market. All amounts are 1e18 fixed point.
 *
 * Positions are never removed once created; a closed position has zero size and entry
 * price but keeps its realized PnL.
 */
public class Position {

    private final String account;
    private final String marketId;

    private BigInteger size = BigInteger.ZERO;            // signed base, >0 long
    private BigInteger margin = BigInteger.ZERO;
    private BigInteger entryPrice = BigInteger.ZERO;
    private BigInteger lastFundingIndex = BigInteger.ZERO;
    private BigInteger realizedPnl = BigInteger.ZERO;

    public Position(String account, String marketId) {
        this.account = account;
        this.marketId = marketId;
    }

    public Position copy() {
        Position p = new Position(account, marketId);
        p.size = size;
        p.margin = margin;
        p.entryPrice = entryPrice;
        p.lastFundingIndex = lastFundingIndex;
        p.realizedPnl = realizedPnl;
        return p;
    }

    public boolean isOpen() {
        return size.signum() != 0;
    }

    public boolean isLong() {
        return size.signum() > 0;
    }

    public BigInteger absSize() {
        return size.abs();
    }

    /**
     * Mark-to-price PnL, rounded down.
     */
    public BigInteger unrealizedPnl(BigInteger price) {
        if (!isOpen()) return BigInteger.ZERO;
        return Wad.mulDiv(price.subtract(entryPrice), size, Wad.ONE, false);
    }

    /**
     * Funding owed (negative) or receivable (positive) against the given cumulative index, rounded down.
     */
    public BigInteger pendingFunding(BigInteger cumulativeIndex) {
        if (!isOpen()) return BigInteger.ZERO;
        return Wad.mulDiv(cumulativeIndex.subtract(lastFundingIndex).negate(), size, Wad.ONE, false);
    }

    public BigInteger notional(BigInteger price, boolean roundUp) {
        return Wad.mulDiv(size.abs(), price, Wad.ONE, roundUp);
    }

    void restoreFrom(Position other) {
        this.size = other.size;
        this.margin = other.margin;
        this.entryPrice = other.entryPrice;
        this.lastFundingIndex = other.lastFundingIndex;
        this.realizedPnl = other.realizedPnl;
    }

    public String getAccount() { return account; }
    public String getMarketId() { return marketId; }

    public BigInteger getSize() { return size; }
    public void setSize(BigInteger size) { this.size = size; }

    public BigInteger getMargin() { return margin; }
    public void setMargin(BigInteger margin) { this.margin = margin; }

    public BigInteger getEntryPrice() { return entryPrice; }
    public void setEntryPrice(BigInteger entryPrice) { this.entryPrice = entryPrice; }

    public BigInteger getLastFundingIndex() { return lastFundingIndex; }
    public void setLastFundingIndex(BigInteger lastFundingIndex) { this.lastFundingIndex = lastFundingIndex; }

    public BigInteger getRealizedPnl() { return realizedPnl; }
    public void addRealizedPnl(BigInteger pnl) { this.realizedPnl = realizedPnl.add(pnl); }

    @Override
    public String toString() {
        return String.format("Position[%s %s size=%s entry=%s margin=%s realized=%s]",
                account, marketId, Wad.format(size), Wad.format(entryPrice),
                Wad.format(margin), Wad.format(realizedPnl));
    }
}
