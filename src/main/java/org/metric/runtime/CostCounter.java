package org.metric.runtime;

/**
 * The single running operation count of one execution. Every {@link Environment} derived
 * from the same execution holds the same instance. Not thread-safe; execution is single-threaded.
 */
public final class CostCounter {

    private long cost = 0;

    public void increment() {
        cost++;
    }

    public long get() {
        return cost;
    }
}
