package com.perpclear.runner;

/**
 * Result of one replayed step. {@code rejection} is null when the step succeeded.
 */
public record StepOutcome(
    int index,
    String action,
    String detail,
    String rejection
) {
    public boolean succeeded() {
        return rejection == null;
    }
}
