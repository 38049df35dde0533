package com.perpclear.core.oracle;

import com.perpclear.core.math.Wad;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class ManualPriceSourceTest {

    @Test
    @DisplayName("Reports the configured price")
    void reportsPrice() {
        ManualPriceSource source = new ManualPriceSource("eth", Wad.of(2000));

        PriceResult result = source.getPrice();

        assertTrue(result.isAvailable());
        assertEquals(Wad.of(2000), result.price());
        assertNull(result.failure());
    }

    @Test
    @DisplayName("Zero price and outages are failures, not quotes")
    void failures() {
        ManualPriceSource source = new ManualPriceSource("eth", BigInteger.ZERO);
        assertFalse(source.getPrice().isAvailable());

        source.setPrice(Wad.of(2000));
        source.setFailing(true);
        PriceResult result = source.getPrice();
        assertFalse(result.isAvailable());
        assertNotNull(result.failure());

        source.setFailing(false);
        assertTrue(source.getPrice().isAvailable());
    }
}
