package com.perpclear.clearing.port;

import java.util.Optional;

public interface MarketDirectory {

    Optional<MarketInfo> getMarket(String marketId);

    boolean isActive(String marketId);
}
