package com.perpclear.core.time;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock advanced by hand. Drives scenario replays and tests.
 */
public class ManualClock implements TimeSource {

    private final AtomicLong now;

    public ManualClock(long startSeconds) {
        this.now = new AtomicLong(startSeconds);
    }

    @Override
    public long nowSeconds() {
        return now.get();
    }

    public long advance(long seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("Clock cannot move backwards");
        }
        return now.addAndGet(seconds);
    }

    public void set(long seconds) {
        if (seconds < now.get()) {
            throw new IllegalArgumentException("Clock cannot move backwards");
        }
        now.set(seconds);
    }
}
