package com.perpclear.clearing;

import com.perpclear.clearing.position.Position;
import com.perpclear.clearing.risk.MarketRiskParams;
import com.perpclear.core.exception.VenueException;
import com.perpclear.pricing.FundingUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Single-writer front of the clearing engine.
 *
 * Every call, reads included, runs on one dedicated thread in submission order, so operations
 * are totally ordered and never interleave. Callers block until their operation finishes and
 * get its result or its exception. A call made from the clearing thread itself runs inline.
 */
public class ClearingService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClearingService.class);

    @FunctionalInterface
    public interface Operation<T> {
        T apply(ClearingHouse house) throws VenueException;
    }

    private final ClearingHouse house;
    private final ExecutorService executor;
    private volatile Thread worker;

    public ClearingService(ClearingHouse house) {
        this.house = house;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "clearing-actor");
            t.setDaemon(true);
            worker = t;
            return t;
        });
    }

    /**
     * Run {@code operation} on the clearing thread and wait for it.
     */
    public <T> T call(Operation<T> operation) throws VenueException {
        if (Thread.currentThread() == worker) {
            return operation.apply(house);
        }
        Future<T> future = executor.submit(() -> operation.apply(house));
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof VenueException) {
                throw (VenueException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Clearing operation failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for clearing operation", e);
        }
    }

    public BigInteger deposit(String account, String token, BigInteger amount) throws VenueException {
        return call(h -> h.deposit(account, token, amount));
    }

    public BigInteger withdraw(String account, String token, BigInteger amount) throws VenueException {
        return call(h -> h.withdraw(account, token, amount));
    }

    public TradeResult openPosition(String account, String marketId, boolean isLong, BigInteger size,
                                    BigInteger priceLimit) throws VenueException {
        return call(h -> h.openPosition(account, marketId, isLong, size, priceLimit));
    }

    public TradeResult closePosition(String account, String marketId, BigInteger size,
                                     BigInteger priceLimit) throws VenueException {
        return call(h -> h.closePosition(account, marketId, size, priceLimit));
    }

    public LiquidationResult liquidate(String liquidator, String account, String marketId, BigInteger size,
                                       BigInteger priceLimit) throws VenueException {
        return call(h -> h.liquidate(liquidator, account, marketId, size, priceLimit));
    }

    public Position addMargin(String account, String marketId, BigInteger amount) throws VenueException {
        return call(h -> h.addMargin(account, marketId, amount));
    }

    public Position removeMargin(String account, String marketId, BigInteger amount) throws VenueException {
        return call(h -> h.removeMargin(account, marketId, amount));
    }

    public BigInteger settleFunding(String account, String marketId) throws VenueException {
        return call(h -> h.settleFunding(account, marketId));
    }

    public FundingUpdate pokeFunding(String marketId) throws VenueException {
        return call(h -> h.pokeFunding(marketId));
    }

    public void setRiskParams(String caller, String marketId, MarketRiskParams params) throws VenueException {
        call(h -> {
            h.setRiskParams(caller, marketId, params);
            return null;
        });
    }

    public Position getPosition(String account, String marketId) throws VenueException {
        return call(h -> h.getPosition(account, marketId));
    }

    public boolean isLiquidatable(String account, String marketId) throws VenueException {
        return call(h -> h.isLiquidatable(account, marketId));
    }

    public List<String> getActiveMarkets(String account) throws VenueException {
        return call(h -> h.getActiveMarkets(account));
    }

    public BigInteger getNotional(String account, String marketId) throws VenueException {
        return call(h -> h.getNotional(account, marketId));
    }

    public BigInteger getMarginRatio(String account, String marketId) throws VenueException {
        return call(h -> h.getMarginRatio(account, marketId));
    }

    public BigInteger getAccountValue(String account) throws VenueException {
        return call(h -> h.getAccountValue(account));
    }

    public BigInteger getFreeCollateral(String account, String token) throws VenueException {
        return call(h -> h.getFreeCollateral(account, token));
    }

    public BigInteger getBadDebt(String token) throws VenueException {
        return call(h -> h.getBadDebt(token));
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Clearing actor did not drain in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("Clearing service stopped");
    }
}
