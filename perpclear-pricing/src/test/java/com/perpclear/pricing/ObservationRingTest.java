package com.perpclear.pricing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class ObservationRingTest {

    private static Observation at(long timestamp) {
        return new Observation(timestamp, BigInteger.valueOf(timestamp), timestamp);
    }

    @Test
    @DisplayName("Cardinality below two is rejected")
    void minimumCardinality() {
        assertThrows(IllegalArgumentException.class, () -> new ObservationRing(1));
    }

    @Test
    @DisplayName("Wrapping drops the oldest observations")
    void wrapsAround() {
        ObservationRing ring = new ObservationRing(3);
        for (long t = 1; t <= 5; t++) {
            ring.write(at(t * 10));
        }

        assertEquals(3, ring.size());
        assertEquals(30, ring.oldest().timestamp());
        assertEquals(50, ring.newest().timestamp());
        assertNull(ring.latestAtOrBefore(25));
        assertEquals(40, ring.latestAtOrBefore(45).timestamp());
    }

    @Test
    @DisplayName("Same-timestamp write replaces the newest slot")
    void overwritesSameTimestamp() {
        ObservationRing ring = new ObservationRing(4);
        ring.write(at(10));
        ring.write(new Observation(10, BigInteger.TEN, 99));

        assertEquals(1, ring.size());
        assertEquals(99, ring.newest().activeSecondsCumulative());
    }

    @Test
    @DisplayName("Copies are independent of the original")
    void copyIsIndependent() {
        ObservationRing ring = new ObservationRing(4);
        ring.write(at(10));
        ObservationRing copy = ring.copy();

        ring.write(at(20));
        ring.clear();

        assertEquals(0, ring.size());
        assertEquals(1, copy.size());
        assertEquals(10, copy.newest().timestamp());
    }
}
