package com.perpclear.clearing;

import com.perpclear.clearing.journal.ClearingJournal;
import com.perpclear.clearing.paper.FeeRouter;
import com.perpclear.clearing.paper.InMemoryCollateralLedger;
import com.perpclear.clearing.paper.InMemoryMarketDirectory;
import com.perpclear.clearing.paper.LedgerInsuranceFund;
import com.perpclear.core.access.AccessControl;
import com.perpclear.core.oracle.ManualPriceSource;
import com.perpclear.core.time.TimeSource;
import com.perpclear.pricing.VirtualAmm;

import java.util.Map;

/**
 * A fully wired paper venue.
 */
public record Venue(
    String admin,
    TimeSource time,
    AccessControl access,
    InMemoryCollateralLedger ledger,
    InMemoryMarketDirectory directory,
    LedgerInsuranceFund insuranceFund,
    FeeRouter feeRouter,
    Map<String, ManualPriceSource> oracles,
    Map<String, VirtualAmm> amms,
    ClearingJournal journal,
    ClearingHouse house,
    ClearingService service
) implements AutoCloseable {

    public ManualPriceSource oracle(String marketId) {
        ManualPriceSource oracle = oracles.get(marketId);
        if (oracle == null) {
            throw new IllegalArgumentException("Unknown market: " + marketId);
        }
        return oracle;
    }

    public VirtualAmm amm(String marketId) {
        VirtualAmm amm = amms.get(marketId);
        if (amm == null) {
            throw new IllegalArgumentException("Unknown market: " + marketId);
        }
        return amm;
    }

    @Override
    public void close() {
        service.close();
        journal.close();
    }
}
