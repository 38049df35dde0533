package com.perpclear.clearing.position;

import com.perpclear.core.exception.RejectReason;
import com.perpclear.core.exception.ValidationException;
import com.perpclear.core.math.Wad;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PositionBookTest {

    @Nested
    @DisplayName("Active markets")
    class ActiveMarketTests {

        @Test
        @DisplayName("Keeps insertion order and enforces the bound")
        void boundedActiveSet() throws ValidationException {
            PositionBook book = new PositionBook(2);
            book.activate("alice", "ETH-PERP");
            book.activate("alice", "BTC-PERP");
            book.activate("alice", "ETH-PERP");

            ValidationException e = assertThrows(ValidationException.class,
                    () -> book.activate("alice", "SOL-PERP"));

            assertEquals(RejectReason.TOO_MANY_MARKETS, e.getReason());
            assertEquals(List.of("ETH-PERP", "BTC-PERP"), book.activeMarkets("alice"));

            book.deactivate("alice", "ETH-PERP");
            book.activate("alice", "SOL-PERP");
            assertEquals(List.of("BTC-PERP", "SOL-PERP"), book.activeMarkets("alice"));
        }

        @Test
        @DisplayName("Restoring an active-set snapshot replaces the current set")
        void restoreActive() throws ValidationException {
            PositionBook book = new PositionBook(4);
            Set<String> empty = book.snapshotActive("alice");
            book.activate("alice", "ETH-PERP");

            book.restoreActive("alice", empty);

            assertFalse(book.isActive("alice", "ETH-PERP"));
            assertTrue(book.activeMarkets("alice").isEmpty());
        }
    }

    @Nested
    @DisplayName("Position snapshots")
    class SnapshotTests {

        @Test
        @DisplayName("Restore keeps the live instance and reverts its fields")
        void restoreInPlace() {
            PositionBook book = new PositionBook(4);
            PositionKey key = new PositionKey("alice", "ETH-PERP");
            Position live = book.getOrCreate("alice", "ETH-PERP");
            live.setSize(Wad.ONE);
            Position before = book.snapshot(key);

            live.setSize(Wad.of(3));
            live.setMargin(Wad.of(600));
            book.restore(key, before);

            assertSame(live, book.get("alice", "ETH-PERP"));
            assertEquals(Wad.ONE, live.getSize());
            assertEquals(BigInteger.ZERO, live.getMargin());
        }

        @Test
        @DisplayName("Restoring a missing snapshot removes positions created since")
        void restoreRemovesCreated() {
            PositionBook book = new PositionBook(4);
            PositionKey key = new PositionKey("bob", "ETH-PERP");
            Position before = book.snapshot(key);
            book.getOrCreate("bob", "ETH-PERP");

            book.restore(key, before);

            assertNull(book.get("bob", "ETH-PERP"));
        }
    }

    @Test
    @DisplayName("Unrealized PnL and pending funding follow the position side")
    void positionArithmetic() {
        Position pos = new Position("alice", "ETH-PERP");
        pos.setSize(Wad.of(-2));
        pos.setEntryPrice(Wad.of(2000));
        pos.setLastFundingIndex(Wad.of(1));

        assertEquals(Wad.of(-200), pos.unrealizedPnl(Wad.of(2100)));
        assertEquals(Wad.of(4), pos.pendingFunding(Wad.of(3)));
        assertEquals(Wad.of(4200), pos.notional(Wad.of(2100), false));
        assertFalse(pos.isLong());
    }
}
