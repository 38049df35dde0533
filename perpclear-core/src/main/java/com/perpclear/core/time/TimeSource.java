package com.perpclear.core.time;

/**
 * Wall clock in whole seconds. Funding and TWAP accounting are second-granular.
 */
@FunctionalInterface
public interface TimeSource {

    long nowSeconds();

    static TimeSource system() {
        return () -> System.currentTimeMillis() / 1000L;
    }
}
