package com.perpclear.core.oracle;

import com.perpclear.core.math.Wad;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Index price set by hand. Used by the paper venue, the scenario runner and tests.
 * Can be switched into a failing state to exercise oracle outages.
 */
public class ManualPriceSource implements IndexPriceSource {

    private static final Logger log = LoggerFactory.getLogger(ManualPriceSource.class);

    private final String name;
    private volatile BigInteger price;
    private volatile boolean failing;

    public ManualPriceSource(String name, BigInteger price) {
        this.name = name;
        this.price = price;
    }

    @Override
    public PriceResult getPrice() {
        if (failing) {
            return PriceResult.failed(name + " feed unavailable");
        }
        return PriceResult.of(price);
    }

    public void setPrice(BigInteger price) {
        log.debug("{} index price -> {}", name, Wad.format(price));
        this.price = price;
    }

    public void setFailing(boolean failing) {
        if (failing != this.failing) {
            log.info("{} feed {}", name, failing ? "down" : "restored");
        }
        this.failing = failing;
    }

    public String getName() {
        return name;
    }
}
