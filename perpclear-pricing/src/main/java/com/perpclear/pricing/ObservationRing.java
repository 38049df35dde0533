package com.perpclear.pricing;

import java.util.Arrays;

/**
 * Fixed-size ring of TWAP observations, newest last.
 * A second write at the same timestamp replaces the newest slot.
 */
public class ObservationRing {

    private final Observation[] slots;
    private int newest = -1;
    private int count;

    public ObservationRing(int cardinality) {
        if (cardinality < 2) {
            throw new IllegalArgumentException("observation cardinality must be at least 2");
        }
        this.slots = new Observation[cardinality];
    }

    private ObservationRing(Observation[] slots, int newest, int count) {
        this.slots = slots;
        this.newest = newest;
        this.count = count;
    }

    public void write(Observation observation) {
        if (count > 0 && slots[newest].timestamp() == observation.timestamp()) {
            slots[newest] = observation;
            return;
        }
        newest = (newest + 1) % slots.length;
        slots[newest] = observation;
        count = Math.min(count + 1, slots.length);
    }

    /**
     * Most recent observation with timestamp at or before the target, or null.
     */
    public Observation latestAtOrBefore(long target) {
        for (int i = 0; i < count; i++) {
            Observation obs = slots[Math.floorMod(newest - i, slots.length)];
            if (obs.timestamp() <= target) {
                return obs;
            }
        }
        return null;
    }

    public Observation oldest() {
        if (count == 0) return null;
        return slots[Math.floorMod(newest - count + 1, slots.length)];
    }

    public Observation newest() {
        return count == 0 ? null : slots[newest];
    }

    public void clear() {
        Arrays.fill(slots, null);
        newest = -1;
        count = 0;
    }

    public int size() {
        return count;
    }

    public int cardinality() {
        return slots.length;
    }

    public ObservationRing copy() {
        return new ObservationRing(slots.clone(), newest, count);
    }
}
