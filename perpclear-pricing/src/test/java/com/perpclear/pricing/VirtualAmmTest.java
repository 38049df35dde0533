package com.perpclear.pricing;

import com.perpclear.core.access.AccessControl;
import com.perpclear.core.exception.AccessDeniedException;
import com.perpclear.core.exception.InsufficientHistoryException;
import com.perpclear.core.exception.RejectReason;
import com.perpclear.core.exception.SlippageExceededException;
import com.perpclear.core.exception.ValidationException;
import com.perpclear.core.math.Wad;
import com.perpclear.core.oracle.ManualPriceSource;
import com.perpclear.core.time.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class VirtualAmmTest {

    private static final long START = 1_700_000_000L;

    private ManualClock clock;
    private ManualPriceSource oracle;
    private AccessControl access;
    private VirtualAmm amm;

    @BeforeEach
    void setUp() throws ValidationException {
        clock = new ManualClock(START);
        oracle = new ManualPriceSource("eth-index", Wad.of(2000));
        access = new AccessControl("admin");
        amm = create(AmmParams.defaults(Wad.of(2000), Wad.of(1000)));
    }

    private VirtualAmm create(AmmParams params) throws ValidationException {
        return new VirtualAmm("ETH-PERP", params, oracle, clock, access);
    }

    @Nested
    @DisplayName("Initialisation")
    class InitTests {

        @Test
        @DisplayName("Quote reserve is derived from price and base reserve")
        void derivesQuoteReserve() {
            assertEquals(Wad.of(2_000_000), amm.getReserveQuote());
            assertEquals(Wad.of(2000), amm.getMarkPrice());
            assertEquals(1, amm.getObservationCount());
        }

        @Test
        @DisplayName("Fee above 300 bps is rejected")
        void rejectsExcessiveFee() {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> create(AmmParams.defaults(Wad.of(2000), Wad.of(1000)).withFeeBps(301)));
            assertEquals(RejectReason.FEE_TOO_HIGH, e.getReason());
        }

        @Test
        @DisplayName("Non-positive price is rejected")
        void rejectsZeroPrice() {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> create(AmmParams.defaults(BigInteger.ZERO, Wad.of(1000))));
            assertEquals(RejectReason.INVALID_PARAMS, e.getReason());
        }
    }

    @Nested
    @DisplayName("Swaps")
    class SwapTests {

        @Test
        @DisplayName("Buying pays above mark and pushes the mark up")
        void buyMovesPriceUp() throws Exception {
            // When
            SwapResult result = amm.buy(Wad.ONE, BigInteger.ZERO);

            // Then
            assertTrue(result.isBuy());
            assertEquals(Wad.ONE, result.baseDelta());
            assertTrue(result.quoteDelta().signum() < 0);
            assertTrue(result.averagePrice().compareTo(Wad.of(2000)) > 0);
            assertTrue(amm.getMarkPrice().compareTo(Wad.of(2000)) > 0);
        }

        @Test
        @DisplayName("Selling receives below mark and pushes the mark down")
        void sellMovesPriceDown() throws Exception {
            SwapResult result = amm.sell(Wad.ONE, BigInteger.ZERO);

            assertFalse(result.isBuy());
            assertEquals(Wad.ONE.negate(), result.baseDelta());
            assertTrue(result.averagePrice().compareTo(Wad.of(2000)) < 0);
            assertTrue(amm.getMarkPrice().compareTo(Wad.of(2000)) < 0);
        }

        @Test
        @DisplayName("Swap fee accrues to fee growth, not to the reserves")
        void feeStaysOutOfReserves() throws Exception {
            BigInteger quoteBefore = amm.getReserveQuote();

            SwapResult result = amm.buy(Wad.ONE, BigInteger.ZERO);

            BigInteger netIn = result.quoteAmount().subtract(result.fee());
            assertEquals(quoteBefore.add(netIn), amm.getReserveQuote());
            assertTrue(result.fee().signum() > 0);
            assertTrue(amm.getFeeGrowthGlobal().signum() > 0);
        }

        @Test
        @DisplayName("Average price beyond the limit rejects and leaves reserves untouched")
        void slippageLimit() {
            BigInteger baseBefore = amm.getReserveBase();

            SlippageExceededException buy = assertThrows(SlippageExceededException.class,
                    () -> amm.buy(Wad.ONE, Wad.of(2001)));
            assertTrue(buy.getAveragePrice().compareTo(buy.getPriceLimit()) > 0);

            assertThrows(SlippageExceededException.class, () -> amm.sell(Wad.ONE, Wad.of(1999)));
            assertEquals(baseBefore, amm.getReserveBase());
        }

        @Test
        @DisplayName("Buying the whole base reserve or breaching the floor is rejected")
        void reserveFloors() {
            ValidationException all = assertThrows(ValidationException.class,
                    () -> amm.buy(Wad.of(1000), BigInteger.ZERO));
            assertEquals(RejectReason.RESERVE_FLOOR, all.getReason());

            ValidationException floor = assertThrows(ValidationException.class,
                    () -> amm.buy(Wad.parse("999.5"), BigInteger.ZERO));
            assertEquals(RejectReason.RESERVE_FLOOR, floor.getReason());
        }

        @Test
        @DisplayName("Zero amounts and dust sells are rejected")
        void zeroAmounts() {
            ValidationException zero = assertThrows(ValidationException.class,
                    () -> amm.buy(BigInteger.ZERO, BigInteger.ZERO));
            assertEquals(RejectReason.ZERO_AMOUNT, zero.getReason());

            ValidationException dust = assertThrows(ValidationException.class,
                    () -> amm.sell(BigInteger.ONE, BigInteger.ZERO));
            assertEquals(RejectReason.ZERO_AMOUNT, dust.getReason());
        }

        @Test
        @DisplayName("Paused swaps are rejected")
        void pausedSwaps() throws Exception {
            amm.setSwapsPaused("admin", true);

            ValidationException e = assertThrows(ValidationException.class,
                    () -> amm.buy(Wad.ONE, BigInteger.ZERO));
            assertEquals(RejectReason.SWAPS_PAUSED, e.getReason());
        }
    }

    @Nested
    @DisplayName("TWAP")
    class TwapTests {

        @Test
        @DisplayName("Zero window returns the mark price")
        void zeroWindow() throws Exception {
            assertEquals(Wad.of(2000), amm.getTwap(0));
        }

        @Test
        @DisplayName("Negative window is rejected")
        void negativeWindow() {
            ValidationException e = assertThrows(ValidationException.class, () -> amm.getTwap(-1));

            assertEquals(RejectReason.INVALID_PARAMS, e.getReason());
        }

        @Test
        @DisplayName("Averages over active time and ignores paused time")
        void excludesPausedTime() throws Exception {
            // Given: 100s at 2000, then 100s at a higher mark, then a long pause
            clock.advance(100);
            amm.buy(Wad.of(100), BigInteger.ZERO);
            BigInteger raisedMark = amm.getMarkPrice();
            clock.advance(100);
            amm.setSwapsPaused("admin", true);
            clock.advance(10_000);
            amm.setSwapsPaused("admin", false);

            // When
            BigInteger twap = amm.getTwap(1_000_000);

            // Then
            assertEquals(Wad.of(2000).add(raisedMark).divide(BigInteger.TWO), twap);
        }

        @Test
        @DisplayName("Fails when retained history is shorter than half the window")
        void insufficientHistoryAfterReset() throws Exception {
            // Given
            clock.advance(1000);
            amm.resetReserves("admin", Wad.of(2100), Wad.of(1000));
            clock.advance(10);

            // When
            InsufficientHistoryException e = assertThrows(InsufficientHistoryException.class,
                    () -> amm.getTwap(900));

            // Then
            assertEquals(900, e.getRequestedWindow());
            assertEquals(10, e.getAvailableSeconds());
            assertEquals(Wad.of(2100), amm.getTwap(20));
        }

        @Test
        @DisplayName("Window longer than the engine's age is clamped")
        void clampsToAge() throws Exception {
            clock.advance(50);

            assertEquals(Wad.of(2000), amm.getTwap(3600));
        }
    }

    @Nested
    @DisplayName("Funding")
    class FundingTests {

        @Test
        @DisplayName("Rate is clamped to the hourly cap and elapsed time to one hour")
        void clampsRate() throws Exception {
            // Given: a steep premium with an amplified funding multiplier
            amm = create(AmmParams.defaults(Wad.of(2000), Wad.of(1000)).withFunding(100, Wad.of(10), 900));
            amm.buy(Wad.of(100), BigInteger.ZERO);
            clock.advance(7200);

            // When
            FundingUpdate update = amm.pokeFunding();

            // Then: 2000 * 100 bps = 20 per hour
            assertTrue(update.isApplied());
            assertEquals(3600, update.elapsedSeconds());
            assertTrue(update.premium().signum() > 0);
            assertEquals(Wad.of(20), update.rate());
            assertEquals(Wad.of(20), amm.getCumulativeFundingPerUnit());
        }

        @Test
        @DisplayName("Longs pay when mark trades above index, shorts when below")
        void signFollowsPremium() throws Exception {
            amm.sell(Wad.of(50), BigInteger.ZERO);
            clock.advance(600);

            FundingUpdate update = amm.pokeFunding();

            assertTrue(update.rate().signum() < 0);
            assertEquals(update.rate(), update.cumulativeIndex());
        }

        @Test
        @DisplayName("Second poke at the same timestamp changes nothing")
        void idempotentWithinTimestamp() throws Exception {
            amm.buy(Wad.of(10), BigInteger.ZERO);
            clock.advance(600);
            FundingUpdate first = amm.pokeFunding();

            FundingUpdate second = amm.pokeFunding();

            assertEquals(FundingUpdate.Status.ALREADY_CURRENT, second.status());
            assertEquals(BigInteger.ZERO, second.rate());
            assertEquals(first.cumulativeIndex(), second.cumulativeIndex());
        }

        @Test
        @DisplayName("Oracle outage defers accrual without moving the index")
        void defersOnOracleFailure() throws Exception {
            amm.buy(Wad.of(10), BigInteger.ZERO);
            clock.advance(600);
            oracle.setFailing(true);

            FundingUpdate update = amm.pokeFunding();

            assertEquals(FundingUpdate.Status.DEFERRED, update.status());
            assertEquals(BigInteger.ZERO, amm.getCumulativeFundingPerUnit());
            assertEquals(clock.nowSeconds(), amm.getLastFundingTimestamp());
        }

        @Test
        @DisplayName("Falls back to the mark price when TWAP history is missing")
        void marksWhenHistoryMissing() throws Exception {
            clock.advance(1000);
            amm.resetReserves("admin", Wad.of(2100), Wad.of(1000));
            clock.advance(10);

            FundingUpdate update = amm.pokeFunding();

            assertTrue(update.isApplied());
            assertEquals(Wad.of(100), update.premium());
        }
    }

    @Nested
    @DisplayName("Administration")
    class AdminTests {

        @Test
        @DisplayName("Reset is limited to a 10% price move")
        void resetBounds() throws Exception {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> amm.resetReserves("admin", Wad.of(2201), Wad.of(1000)));
            assertEquals(RejectReason.PRICE_MOVE_TOO_LARGE, e.getReason());

            amm.resetReserves("admin", Wad.of(2200), Wad.of(500));
            assertEquals(Wad.of(2200), amm.getMarkPrice());
            assertEquals(1, amm.getObservationCount());
        }

        @Test
        @DisplayName("Non-admins cannot change parameters")
        void requiresAdmin() {
            assertThrows(AccessDeniedException.class, () -> amm.setFeeBps("bob", 5));
            assertThrows(AccessDeniedException.class, () -> amm.setSwapsPaused("bob", true));
            assertThrows(AccessDeniedException.class,
                    () -> amm.resetReserves("bob", Wad.of(2000), Wad.of(1000)));
        }

        @Test
        @DisplayName("Fee updates are bounded")
        void feeBounds() throws Exception {
            ValidationException e = assertThrows(ValidationException.class, () -> amm.setFeeBps("admin", 301));
            assertEquals(RejectReason.FEE_TOO_HIGH, e.getReason());

            amm.setFeeBps("admin", 300);
            assertEquals(300, amm.getFeeBps());
        }

        @Test
        @DisplayName("Restoring a snapshot undoes a swap")
        void snapshotRestore() throws Exception {
            VirtualAmm.Snapshot before = amm.snapshot();
            clock.advance(30);
            amm.buy(Wad.of(5), BigInteger.ZERO);

            amm.restore(before);

            assertEquals(Wad.of(1000), amm.getReserveBase());
            assertEquals(Wad.of(2000), amm.getMarkPrice());
            assertEquals(BigInteger.ZERO, amm.getFeeGrowthGlobal());
            assertEquals(1, amm.getObservationCount());
        }
    }
}
