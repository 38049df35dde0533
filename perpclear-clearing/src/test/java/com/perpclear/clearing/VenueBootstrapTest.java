package com.perpclear.clearing;

import com.perpclear.core.config.VenueConfig;
import com.perpclear.core.exception.RejectReason;
import com.perpclear.core.exception.ValidationException;
import com.perpclear.core.exception.VenueException;
import com.perpclear.core.math.Wad;
import com.perpclear.core.time.ManualClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.perpclear.clearing.TestVenues.*;
import static org.junit.jupiter.api.Assertions.*;

class VenueBootstrapTest {

    @Test
    @DisplayName("Wires markets, oracles, risk params and seeds insurance")
    void wiresVenue() throws VenueException {
        VenueConfig config = TestVenues.twoMarkets();
        config.getInsurance().setInitialBalance("2500");
        config.getMarkets().get(1).getOracle().setPrice("29950");

        try (Venue venue = VenueBootstrap.create(config, new ManualClock(START))) {
            assertEquals(Wad.of(2000), venue.amm(ETH).getMarkPrice());
            assertEquals(Wad.of(30000), venue.amm(BTC).getMarkPrice());
            assertEquals(Wad.of(2000), venue.oracle(ETH).getPrice().price());
            assertEquals(Wad.of(29950), venue.oracle(BTC).getPrice().price());
            assertTrue(venue.house().getRiskParams(BTC).isPresent());
            assertEquals(usdc(2500), venue.insuranceFund().balance(USDC));
            assertThrows(IllegalArgumentException.class, () -> venue.amm("DOGE-PERP"));
        }
    }

    @Test
    @DisplayName("Markets quoting unknown tokens are rejected")
    void unknownQuoteToken() {
        VenueConfig config = TestVenues.singleMarket();
        config.getMarkets().get(0).setQuoteToken("DAI");

        ValidationException e = assertThrows(ValidationException.class,
                () -> VenueBootstrap.create(config, new ManualClock(START)));
        assertEquals(RejectReason.UNKNOWN_TOKEN, e.getReason());
    }

    @Test
    @DisplayName("Market fee above the cap is rejected")
    void feeCap() {
        VenueConfig config = TestVenues.singleMarket();
        config.getMarkets().get(0).setFeeBps(500);

        ValidationException e = assertThrows(ValidationException.class,
                () -> VenueBootstrap.create(config, new ManualClock(START)));
        assertEquals(RejectReason.FEE_TOO_HIGH, e.getReason());
    }
}
