package com.perpclear.clearing.position;

import com.perpclear.core.exception.RejectReason;
import com.perpclear.core.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keyed position store plus each account's active-market set.
 *
 * The active set is bounded so that scans over it (withdraw guard, funding sweeps,
 * liquidatable checks) stay cheap. Owned by the clearing actor; not thread-safe.
 */
public class PositionBook {

    private final int maxActiveMarkets;
    private final Map<PositionKey, Position> positions = new HashMap<>();
    private final Map<String, LinkedHashSet<String>> activeMarkets = new HashMap<>();

    public PositionBook(int maxActiveMarkets) {
        if (maxActiveMarkets <= 0) {
            throw new IllegalArgumentException("maxActiveMarkets must be positive");
        }
        this.maxActiveMarkets = maxActiveMarkets;
    }

    /** Null when the account never traded the market. */
    public Position get(String account, String marketId) {
        return positions.get(new PositionKey(account, marketId));
    }

    public Position getOrCreate(String account, String marketId) {
        return positions.computeIfAbsent(new PositionKey(account, marketId),
                k -> new Position(account, marketId));
    }

    /** Active markets of the account, in the order they were opened. */
    public List<String> activeMarkets(String account) {
        LinkedHashSet<String> set = activeMarkets.get(account);
        return set == null ? Collections.emptyList() : new ArrayList<>(set);
    }

    public boolean isActive(String account, String marketId) {
        LinkedHashSet<String> set = activeMarkets.get(account);
        return set != null && set.contains(marketId);
    }

    public void activate(String account, String marketId) throws ValidationException {
        LinkedHashSet<String> set = activeMarkets.computeIfAbsent(account, k -> new LinkedHashSet<>());
        if (set.contains(marketId)) return;
        if (set.size() >= maxActiveMarkets) {
            throw new ValidationException(String.format("%s already has %d active markets",
                    account, set.size()), RejectReason.TOO_MANY_MARKETS);
        }
        set.add(marketId);
    }

    public void deactivate(String account, String marketId) {
        LinkedHashSet<String> set = activeMarkets.get(account);
        if (set != null) {
            set.remove(marketId);
        }
    }

    public int getMaxActiveMarkets() {
        return maxActiveMarkets;
    }

    // --- Rollback support ---

    /** Copy of the stored position, or null if none exists. */
    public Position snapshot(PositionKey key) {
        Position p = positions.get(key);
        return p == null ? null : p.copy();
    }

    public void restore(PositionKey key, Position before) {
        if (before == null) {
            positions.remove(key);
            return;
        }
        Position current = positions.get(key);
        if (current == null) {
            positions.put(key, before.copy());
        } else {
            current.restoreFrom(before);
        }
    }

    public Set<String> snapshotActive(String account) {
        LinkedHashSet<String> set = activeMarkets.get(account);
        return set == null ? null : new LinkedHashSet<>(set);
    }

    public void restoreActive(String account, Set<String> before) {
        if (before == null) {
            activeMarkets.remove(account);
        } else {
            activeMarkets.put(account, new LinkedHashSet<>(before));
        }
    }
}
