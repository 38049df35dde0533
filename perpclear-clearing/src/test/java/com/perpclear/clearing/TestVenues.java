package com.perpclear.clearing;

import com.perpclear.core.config.VenueConfig;

import java.math.BigInteger;

/**
 * Venue configurations shared by the clearing tests.
 */
final class TestVenues {

    static final String USDC = "USDC";
    static final String ETH = "ETH-PERP";
    static final String BTC = "BTC-PERP";
    static final long START = 1_700_000_000L;

    private TestVenues() {}

    /** One USDC-margined ETH market at 2000 with a 1000 ETH virtual base reserve. */
    static VenueConfig singleMarket() {
        VenueConfig config = new VenueConfig();
        VenueConfig.TokenConfigEntry usdc = new VenueConfig.TokenConfigEntry();
        usdc.setSymbol(USDC);
        usdc.setDecimals(6);
        config.getTokens().add(usdc);
        config.getMarkets().add(market(ETH, "ETH", "2000", "1000"));
        // Fees go to the treasury so insurance balances only move on explicit payouts
        config.getFeeRouter().setInsuranceShareBps(0);
        return config;
    }

    static VenueConfig twoMarkets() {
        VenueConfig config = singleMarket();
        config.getMarkets().add(market(BTC, "BTC", "30000", "100"));
        return config;
    }

    static VenueConfig.MarketConfig market(String id, String base, String price, String baseReserve) {
        VenueConfig.MarketConfig market = new VenueConfig.MarketConfig();
        market.setId(id);
        market.setBaseToken(base);
        market.setQuoteToken(USDC);
        market.getAmm().setInitialPrice(price);
        market.getAmm().setBaseReserve(baseReserve);
        return market;
    }

    /** Whole USDC in native units. */
    static BigInteger usdc(long amount) {
        return BigInteger.valueOf(amount).multiply(BigInteger.valueOf(1_000_000));
    }
}
