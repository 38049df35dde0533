package com.perpclear.clearing.journal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * Base event type for clearing journal entries.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "eventType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = PositionEvent.class, name = "position"),
    @JsonSubTypes.Type(value = FundingEvent.class, name = "funding"),
    @JsonSubTypes.Type(value = LiquidationEvent.class, name = "liquidation"),
    @JsonSubTypes.Type(value = BadDebtEvent.class, name = "badDebt")
})
@JsonIgnoreProperties(value = {"summary"}, allowGetters = true)
public abstract class ClearingEvent {
    private Instant timestamp;
    private long venueTime;     // venue clock, epoch seconds
    private String account;
    private String marketId;

    protected ClearingEvent() {
        this.timestamp = Instant.now();
    }

    protected ClearingEvent(long venueTime, String account, String marketId) {
        this.timestamp = Instant.now();
        this.venueTime = venueTime;
        this.account = account;
        this.marketId = marketId;
    }

    public Instant getTimestamp() { return timestamp; }
    public long getVenueTime() { return venueTime; }
    public String getAccount() { return account; }
    public String getMarketId() { return marketId; }

    // Written by the type id
    @JsonIgnore
    public abstract String getEventType();
    public abstract String getSummary();
}
