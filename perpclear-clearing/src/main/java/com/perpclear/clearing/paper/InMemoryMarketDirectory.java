package com.perpclear.clearing.paper;

import com.perpclear.clearing.port.MarketDirectory;
import com.perpclear.clearing.port.MarketInfo;
import com.perpclear.core.exception.RejectReason;
import com.perpclear.core.exception.ValidationException;
import com.perpclear.pricing.VirtualAmm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Market registry for the paper venue.
 */
public class InMemoryMarketDirectory implements MarketDirectory {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMarketDirectory.class);

    private final Map<String, MarketInfo> markets = new ConcurrentHashMap<>();
    private final Set<String> delisted = ConcurrentHashMap.newKeySet();

    public void register(MarketInfo market) throws ValidationException {
        if (market.feeBps() < 0 || market.feeBps() > VirtualAmm.MAX_FEE_BPS) {
            throw new ValidationException("Market fee " + market.feeBps() + " bps above cap "
                    + VirtualAmm.MAX_FEE_BPS, RejectReason.FEE_TOO_HIGH);
        }
        markets.put(market.marketId(), market);
        delisted.remove(market.marketId());
        log.info("Market registered: {} ({}/{}, fee={}bps)", market.marketId(),
                market.baseToken(), market.quoteToken(), market.feeBps());
    }

    public void setPaused(String marketId, boolean paused) {
        markets.computeIfPresent(marketId, (id, m) -> m.withPaused(paused));
        log.info("Market {} {}", marketId, paused ? "paused" : "unpaused");
    }

    public void delist(String marketId) {
        delisted.add(marketId);
        log.info("Market {} delisted", marketId);
    }

    @Override
    public Optional<MarketInfo> getMarket(String marketId) {
        return Optional.ofNullable(markets.get(marketId));
    }

    @Override
    public boolean isActive(String marketId) {
        return markets.containsKey(marketId) && !delisted.contains(marketId);
    }
}
