package com.perpclear.clearing.risk;

import com.perpclear.core.exception.InsufficientHistoryException;
import com.perpclear.core.exception.PriceUnavailableException;
import com.perpclear.core.exception.ValidationException;
import com.perpclear.core.oracle.IndexPriceSource;
import com.perpclear.core.oracle.PriceResult;
import com.perpclear.pricing.VirtualAmm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Resolves the risk price of a market: oracle, then TWAP over the observation window,
 * then mark. Fails only when none of them is available.
 */
public class RiskPriceResolver {

    private static final Logger log = LoggerFactory.getLogger(RiskPriceResolver.class);

    public RiskPrice resolve(String marketId, IndexPriceSource oracle, VirtualAmm amm)
            throws PriceUnavailableException {
        PriceResult index = read(oracle);
        if (index.isAvailable()) {
            return new RiskPrice(index.price(), RiskPrice.Source.ORACLE);
        }
        log.warn("{} oracle unavailable ({}), falling back to TWAP", marketId, index.failure());

        try {
            BigInteger twap = amm.getTwap(amm.getObservationWindow());
            if (twap.signum() > 0) {
                return new RiskPrice(twap, RiskPrice.Source.TWAP);
            }
        } catch (InsufficientHistoryException | ValidationException e) {
            log.warn("{} TWAP unavailable ({}), falling back to mark", marketId, e.getMessage());
        } catch (IllegalStateException e) {
            log.warn("{} TWAP unavailable: {}", marketId, e.getMessage());
        }

        try {
            BigInteger mark = amm.getMarkPrice();
            if (mark.signum() > 0) {
                return new RiskPrice(mark, RiskPrice.Source.MARK);
            }
        } catch (IllegalStateException e) {
            log.error("{} mark price unavailable: {}", marketId, e.getMessage());
        }
        throw new PriceUnavailableException("No price source available for " + marketId);
    }

    private static PriceResult read(IndexPriceSource oracle) {
        if (oracle == null) {
            return PriceResult.failed("no oracle configured");
        }
        try {
            PriceResult result = oracle.getPrice();
            return result != null ? result : PriceResult.failed("oracle returned nothing");
        } catch (RuntimeException e) {
            return PriceResult.failed("oracle error: " + e.getMessage());
        }
    }
}
