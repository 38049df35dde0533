package com.perpclear.pricing;

import com.perpclear.core.access.AccessControl;
import com.perpclear.core.access.Role;
import com.perpclear.core.exception.AccessDeniedException;
import com.perpclear.core.exception.InsufficientHistoryException;
import com.perpclear.core.exception.RejectReason;
import com.perpclear.core.exception.SlippageExceededException;
import com.perpclear.core.exception.ValidationException;
import com.perpclear.core.math.Wad;
import com.perpclear.core.oracle.IndexPriceSource;
import com.perpclear.core.oracle.PriceResult;
import com.perpclear.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Virtual constant-product market maker for one perpetual market.
 *
 * Holds the virtual reserves, the TWAP observation ring and the cumulative funding index.
 * Not thread-safe: a single clearing actor owns every instance.
 */
public class VirtualAmm {

    private static final Logger log = LoggerFactory.getLogger(VirtualAmm.class);

    public static final int MAX_FEE_BPS = 300;
    public static final long MAX_FUNDING_ELAPSED = 3600;
    public static final int MAX_RESET_MOVE_BPS = 1000;

    private static final BigInteger SECONDS_PER_DAY = BigInteger.valueOf(86_400);
    private static final BigInteger SECONDS_PER_HOUR = BigInteger.valueOf(3_600);

    private final String marketId;
    private final IndexPriceSource oracle;
    private final TimeSource time;
    private final AccessControl access;
    private final long initTimestamp;

    private BigInteger reserveBase;
    private BigInteger reserveQuote;
    private BigInteger minReserveBase;
    private BigInteger minReserveQuote;
    private int feeBps;
    private int frMaxBpsPerHour;
    private BigInteger fundingK;
    private long observationWindow;

    private BigInteger feeGrowthGlobal = BigInteger.ZERO;
    private BigInteger cumulativeFundingPerUnit = BigInteger.ZERO;
    private long lastFundingTimestamp;
    private boolean swapsPaused;

    private BigInteger priceCumulative = BigInteger.ZERO;
    private long activeSecondsCumulative;
    private long lastAccumulateTimestamp;
    private ObservationRing observations;

    public VirtualAmm(String marketId, AmmParams params, IndexPriceSource oracle,
                      TimeSource time, AccessControl access) throws ValidationException {
        validateFee(params.feeBps());
        validateFunding(params.frMaxBpsPerHour(), params.fundingK(), params.observationWindow());
        if (params.initialPrice().signum() <= 0 || params.baseReserve().signum() <= 0) {
            throw new ValidationException("Initial price and base reserve must be positive",
                    RejectReason.INVALID_PARAMS);
        }
        this.marketId = marketId;
        this.oracle = oracle;
        this.time = time;
        this.access = access;
        this.feeBps = params.feeBps();
        this.frMaxBpsPerHour = params.frMaxBpsPerHour();
        this.fundingK = params.fundingK();
        this.observationWindow = params.observationWindow();
        this.minReserveBase = params.minReserveBase();
        this.minReserveQuote = params.minReserveQuote();
        this.reserveBase = params.baseReserve();
        this.reserveQuote = Wad.mulDown(params.baseReserve(), params.initialPrice());
        checkFloors(reserveBase, reserveQuote);

        this.initTimestamp = time.nowSeconds();
        this.lastAccumulateTimestamp = initTimestamp;
        this.lastFundingTimestamp = initTimestamp;
        this.observations = new ObservationRing(params.observationCardinality());
        observations.write(new Observation(initTimestamp, priceCumulative, activeSecondsCumulative));

        log.info("vAMM {} initialised: price={} base={} quote={} fee={}bps",
                marketId, Wad.format(getMarkPrice()), Wad.format(reserveBase),
                Wad.format(reserveQuote), feeBps);
    }

    // --- Swaps ---

    /**
     * Buy {@code baseOut} base from the pool. The trader pays gross quote including the fee.
     *
     * @param priceLimit maximum acceptable average price, 0 for none
     */
    public SwapResult buy(BigInteger baseOut, BigInteger priceLimit)
            throws ValidationException, SlippageExceededException {
        requireTradable(baseOut);
        long now = time.nowSeconds();
        accumulate(now);

        if (baseOut.compareTo(reserveBase) >= 0) {
            throw new ValidationException("Buy exceeds virtual base reserve", RejectReason.RESERVE_FLOOR);
        }
        BigInteger k = reserveBase.multiply(reserveQuote);
        BigInteger newBase = reserveBase.subtract(baseOut);
        BigInteger newQuote = ceilDiv(k, newBase);
        BigInteger netQuoteIn = newQuote.subtract(reserveQuote);
        BigInteger grossQuoteIn = Wad.mulDiv(netQuoteIn, Wad.BPS,
                Wad.BPS.subtract(BigInteger.valueOf(feeBps)), true);
        BigInteger fee = grossQuoteIn.subtract(netQuoteIn);
        BigInteger avgPrice = Wad.mulDiv(grossQuoteIn, Wad.ONE, baseOut, true);

        if (priceLimit != null && priceLimit.signum() > 0 && avgPrice.compareTo(priceLimit) > 0) {
            throw new SlippageExceededException(String.format("Buy avg price %s above limit %s",
                    Wad.format(avgPrice), Wad.format(priceLimit)), avgPrice, priceLimit);
        }
        checkFloors(newBase, newQuote);

        reserveBase = newBase;
        reserveQuote = newQuote;
        feeGrowthGlobal = feeGrowthGlobal.add(Wad.mulDiv(fee, Wad.ONE, reserveBase, false));
        observe(now);

        log.debug("{} buy {} @ {} (fee {})", marketId, Wad.format(baseOut), Wad.format(avgPrice), Wad.format(fee));
        return new SwapResult(baseOut, grossQuoteIn.negate(), avgPrice, fee);
    }

    /**
     * Sell {@code baseIn} base into the pool. The fee is taken from the base input.
     *
     * @param priceLimit minimum acceptable average price, 0 for none
     */
    public SwapResult sell(BigInteger baseIn, BigInteger priceLimit)
            throws ValidationException, SlippageExceededException {
        requireTradable(baseIn);
        long now = time.nowSeconds();
        accumulate(now);

        BigInteger markBefore = getMarkPrice();
        BigInteger feeBase = Wad.bps(baseIn, feeBps, true);
        BigInteger netBaseIn = baseIn.subtract(feeBase);
        BigInteger k = reserveBase.multiply(reserveQuote);
        BigInteger newBase = reserveBase.add(netBaseIn);
        BigInteger newQuote = ceilDiv(k, newBase);
        BigInteger quoteOut = reserveQuote.subtract(newQuote);
        if (quoteOut.signum() <= 0) {
            throw new ValidationException("Sell too small to produce quote output", RejectReason.ZERO_AMOUNT);
        }
        BigInteger avgPrice = Wad.mulDiv(quoteOut, Wad.ONE, baseIn, true);

        if (priceLimit != null && priceLimit.signum() > 0 && avgPrice.compareTo(priceLimit) < 0) {
            throw new SlippageExceededException(String.format("Sell avg price %s below limit %s",
                    Wad.format(avgPrice), Wad.format(priceLimit)), avgPrice, priceLimit);
        }
        checkFloors(newBase, newQuote);

        BigInteger fee = Wad.mulDown(feeBase, markBefore);
        reserveBase = newBase;
        reserveQuote = newQuote;
        feeGrowthGlobal = feeGrowthGlobal.add(Wad.mulDiv(fee, Wad.ONE, reserveBase, false));
        observe(now);

        log.debug("{} sell {} @ {} (fee {})", marketId, Wad.format(baseIn), Wad.format(avgPrice), Wad.format(fee));
        return new SwapResult(baseIn.negate(), quoteOut, avgPrice, fee);
    }

    // --- Prices ---

    public BigInteger getMarkPrice() {
        if (reserveBase.signum() == 0) {
            throw new IllegalStateException("vAMM " + marketId + " has no base reserve");
        }
        return Wad.divDown(reserveQuote, reserveBase);
    }

    /**
     * Time-weighted mark price over the trailing window (seconds). Windows longer than the
     * engine's age are clamped to it. Fails when no retained observation is at least half
     * the window old. A zero window is the current mark.
     */
    public BigInteger getTwap(long window) throws InsufficientHistoryException, ValidationException {
        if (window < 0) {
            throw new ValidationException("TWAP window cannot be negative: " + window, RejectReason.INVALID_PARAMS);
        }
        long now = time.nowSeconds();
        long effective = Math.min(window, now - initTimestamp);
        BigInteger mark = getMarkPrice();
        if (effective <= 0) {
            return mark;
        }

        Observation base = observations.latestAtOrBefore(now - effective);
        if (base == null) {
            Observation oldest = observations.oldest();
            long available = oldest == null ? 0 : now - oldest.timestamp();
            if (oldest == null || available * 2 < effective) {
                throw new InsufficientHistoryException(String.format(
                        "TWAP window %ds needs an observation at least %ds old, oldest is %ds",
                        effective, (effective + 1) / 2, available), effective, available);
            }
            base = oldest;
        }

        long pending = swapsPaused ? 0 : now - lastAccumulateTimestamp;
        BigInteger currentCumulative = priceCumulative.add(mark.multiply(BigInteger.valueOf(pending)));
        long currentActive = activeSecondsCumulative + pending;

        long activeSpan = currentActive - base.activeSecondsCumulative();
        if (activeSpan <= 0) {
            return mark;
        }
        return currentCumulative.subtract(base.priceCumulative())
                .divide(BigInteger.valueOf(activeSpan));
    }

    // --- Funding ---

    /**
     * Advance the cumulative funding index. Idempotent within a timestamp. An unavailable
     * index price defers accrual instead of failing or charging against a phantom price.
     */
    public FundingUpdate pokeFunding() {
        long now = time.nowSeconds();
        if (now <= lastFundingTimestamp) {
            return new FundingUpdate(now, 0, BigInteger.ZERO, BigInteger.ZERO,
                    cumulativeFundingPerUnit, FundingUpdate.Status.ALREADY_CURRENT);
        }
        long elapsed = Math.min(now - lastFundingTimestamp, MAX_FUNDING_ELAPSED);

        PriceResult index = readOracle();
        if (!index.isAvailable()) {
            lastFundingTimestamp = now;
            log.warn("{} funding deferred: {}", marketId, index.failure());
            return new FundingUpdate(now, elapsed, BigInteger.ZERO, BigInteger.ZERO,
                    cumulativeFundingPerUnit, FundingUpdate.Status.DEFERRED);
        }

        BigInteger twap;
        try {
            twap = getTwap(observationWindow);
        } catch (InsufficientHistoryException | ValidationException e) {
            twap = getMarkPrice();
            log.debug("{} funding uses mark price: {}", marketId, e.getMessage());
        }

        BigInteger indexPrice = index.price();
        BigInteger premium = twap.subtract(indexPrice);
        BigInteger elapsedBig = BigInteger.valueOf(elapsed);
        BigInteger rate = Wad.mulDivTowardZero(premium.multiply(fundingK), elapsedBig,
                SECONDS_PER_DAY.multiply(Wad.ONE));
        BigInteger cap = Wad.mulDiv(indexPrice.multiply(BigInteger.valueOf(frMaxBpsPerHour)), elapsedBig,
                Wad.BPS.multiply(SECONDS_PER_HOUR), false);
        if (rate.abs().compareTo(cap) > 0) {
            rate = rate.signum() > 0 ? cap : cap.negate();
        }

        cumulativeFundingPerUnit = cumulativeFundingPerUnit.add(rate);
        lastFundingTimestamp = now;
        log.debug("{} funding: twap={} index={} rate={} cumulative={}", marketId,
                Wad.format(twap), Wad.format(indexPrice), Wad.format(rate), Wad.format(cumulativeFundingPerUnit));
        return new FundingUpdate(now, elapsed, premium, rate, cumulativeFundingPerUnit,
                FundingUpdate.Status.APPLIED);
    }

    // --- Admin ---

    /**
     * Emergency reserve reset. The new mark may move at most 10% from the current one.
     * Observation history restarts at the reset.
     */
    public void resetReserves(String caller, BigInteger newPrice, BigInteger newBaseReserve)
            throws AccessDeniedException, ValidationException {
        access.check(caller, Role.ADMIN);
        if (newPrice.signum() <= 0 || newBaseReserve.signum() <= 0) {
            throw new ValidationException("Reset price and base reserve must be positive", RejectReason.INVALID_PARAMS);
        }
        BigInteger oldMark = getMarkPrice();
        BigInteger move = newPrice.subtract(oldMark).abs();
        if (move.multiply(Wad.BPS).compareTo(oldMark.multiply(BigInteger.valueOf(MAX_RESET_MOVE_BPS))) > 0) {
            throw new ValidationException(String.format("Reset moves price %s -> %s, more than %d bps",
                    Wad.format(oldMark), Wad.format(newPrice), MAX_RESET_MOVE_BPS), RejectReason.PRICE_MOVE_TOO_LARGE);
        }
        BigInteger newQuote = Wad.mulDown(newBaseReserve, newPrice);
        checkFloors(newBaseReserve, newQuote);

        long now = time.nowSeconds();
        accumulate(now);
        reserveBase = newBaseReserve;
        reserveQuote = newQuote;
        observations.clear();
        observations.write(new Observation(now, priceCumulative, activeSecondsCumulative));
        log.warn("vAMM {} reserves reset by {}: price {} -> {}, base={}", marketId, caller,
                Wad.format(oldMark), Wad.format(getMarkPrice()), Wad.format(reserveBase));
    }

    public void setSwapsPaused(String caller, boolean paused) throws AccessDeniedException {
        access.check(caller, Role.ADMIN);
        if (paused == swapsPaused) return;
        long now = time.nowSeconds();
        accumulate(now);
        swapsPaused = paused;
        observe(now);
        log.info("vAMM {} swaps {} by {}", marketId, paused ? "paused" : "resumed", caller);
    }

    public void setFeeBps(String caller, int bps) throws AccessDeniedException, ValidationException {
        access.check(caller, Role.ADMIN);
        validateFee(bps);
        log.info("vAMM {} fee {} -> {} bps", marketId, feeBps, bps);
        this.feeBps = bps;
    }

    public void setFundingParams(String caller, int maxBpsPerHour, BigInteger k, long window)
            throws AccessDeniedException, ValidationException {
        access.check(caller, Role.ADMIN);
        validateFunding(maxBpsPerHour, k, window);
        this.frMaxBpsPerHour = maxBpsPerHour;
        this.fundingK = k;
        this.observationWindow = window;
        log.info("vAMM {} funding params: max={}bps/h k={} window={}s", marketId, maxBpsPerHour, Wad.format(k), window);
    }

    public void setMinReserves(String caller, BigInteger minBase, BigInteger minQuote)
            throws AccessDeniedException, ValidationException {
        access.check(caller, Role.ADMIN);
        if (minBase.signum() < 0 || minQuote.signum() < 0) {
            throw new ValidationException("Reserve floors cannot be negative", RejectReason.INVALID_PARAMS);
        }
        this.minReserveBase = minBase;
        this.minReserveQuote = minQuote;
        log.info("vAMM {} reserve floors: base={} quote={}", marketId, Wad.format(minBase), Wad.format(minQuote));
    }

    // --- Rollback support ---

    public Snapshot snapshot() {
        return new Snapshot(reserveBase, reserveQuote, minReserveBase, minReserveQuote, feeBps,
                frMaxBpsPerHour, fundingK, observationWindow, feeGrowthGlobal, cumulativeFundingPerUnit,
                lastFundingTimestamp, swapsPaused, priceCumulative, activeSecondsCumulative,
                lastAccumulateTimestamp, observations.copy());
    }

    public void restore(Snapshot s) {
        reserveBase = s.reserveBase();
        reserveQuote = s.reserveQuote();
        minReserveBase = s.minReserveBase();
        minReserveQuote = s.minReserveQuote();
        feeBps = s.feeBps();
        frMaxBpsPerHour = s.frMaxBpsPerHour();
        fundingK = s.fundingK();
        observationWindow = s.observationWindow();
        feeGrowthGlobal = s.feeGrowthGlobal();
        cumulativeFundingPerUnit = s.cumulativeFundingPerUnit();
        lastFundingTimestamp = s.lastFundingTimestamp();
        swapsPaused = s.swapsPaused();
        priceCumulative = s.priceCumulative();
        activeSecondsCumulative = s.activeSecondsCumulative();
        lastAccumulateTimestamp = s.lastAccumulateTimestamp();
        observations = s.observations().copy();
    }

    public record Snapshot(
        BigInteger reserveBase,
        BigInteger reserveQuote,
        BigInteger minReserveBase,
        BigInteger minReserveQuote,
        int feeBps,
        int frMaxBpsPerHour,
        BigInteger fundingK,
        long observationWindow,
        BigInteger feeGrowthGlobal,
        BigInteger cumulativeFundingPerUnit,
        long lastFundingTimestamp,
        boolean swapsPaused,
        BigInteger priceCumulative,
        long activeSecondsCumulative,
        long lastAccumulateTimestamp,
        ObservationRing observations
    ) {}

    // --- Internals ---

    private void requireTradable(BigInteger amount) throws ValidationException {
        if (swapsPaused) {
            throw new ValidationException("Swaps paused on " + marketId, RejectReason.SWAPS_PAUSED);
        }
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Swap amount must be positive", RejectReason.ZERO_AMOUNT);
        }
    }

    private void checkFloors(BigInteger base, BigInteger quote) throws ValidationException {
        if (base.compareTo(minReserveBase) < 0 || quote.compareTo(minReserveQuote) < 0) {
            throw new ValidationException(String.format("Reserves %s/%s would breach floors %s/%s",
                    Wad.format(base), Wad.format(quote), Wad.format(minReserveBase), Wad.format(minReserveQuote)),
                    RejectReason.RESERVE_FLOOR);
        }
    }

    private void accumulate(long now) {
        if (now <= lastAccumulateTimestamp) return;
        if (!swapsPaused) {
            long dt = now - lastAccumulateTimestamp;
            priceCumulative = priceCumulative.add(getMarkPrice().multiply(BigInteger.valueOf(dt)));
            activeSecondsCumulative += dt;
        }
        lastAccumulateTimestamp = now;
    }

    private void observe(long now) {
        accumulate(now);
        observations.write(new Observation(now, priceCumulative, activeSecondsCumulative));
    }

    private PriceResult readOracle() {
        try {
            PriceResult result = oracle.getPrice();
            return result != null ? result : PriceResult.failed("oracle returned nothing");
        } catch (RuntimeException e) {
            return PriceResult.failed("oracle error: " + e.getMessage());
        }
    }

    private static BigInteger ceilDiv(BigInteger a, BigInteger b) {
        BigInteger[] qr = a.divideAndRemainder(b);
        return qr[1].signum() == 0 ? qr[0] : qr[0].add(BigInteger.ONE);
    }

    private static void validateFee(int bps) throws ValidationException {
        if (bps < 0 || bps > MAX_FEE_BPS) {
            throw new ValidationException("Swap fee " + bps + " bps outside [0, " + MAX_FEE_BPS + "]",
                    RejectReason.FEE_TOO_HIGH);
        }
    }

    private static void validateFunding(int maxBpsPerHour, BigInteger k, long window) throws ValidationException {
        if (maxBpsPerHour < 0 || k == null || k.signum() < 0 || window <= 0) {
            throw new ValidationException("Invalid funding parameters", RejectReason.INVALID_PARAMS);
        }
    }

    // --- Accessors ---

    public String getMarketId() { return marketId; }
    public BigInteger getReserveBase() { return reserveBase; }
    public BigInteger getReserveQuote() { return reserveQuote; }
    public int getFeeBps() { return feeBps; }
    public int getFrMaxBpsPerHour() { return frMaxBpsPerHour; }
    public BigInteger getFundingK() { return fundingK; }
    public long getObservationWindow() { return observationWindow; }
    public BigInteger getFeeGrowthGlobal() { return feeGrowthGlobal; }
    public BigInteger getCumulativeFundingPerUnit() { return cumulativeFundingPerUnit; }
    public long getLastFundingTimestamp() { return lastFundingTimestamp; }
    public boolean isSwapsPaused() { return swapsPaused; }
    public int getObservationCount() { return observations.size(); }
    public IndexPriceSource getOracle() { return oracle; }
}
