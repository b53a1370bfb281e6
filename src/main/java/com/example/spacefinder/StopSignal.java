package com.example.spacefinder;

/**
 * Cooperative cancellation flag polled by long-running operations.
 */
@FunctionalInterface
public interface StopSignal {
    /**
     * Returns true once the caller wants the running operation to return early.
     */
    boolean shouldStop();

    /**
     * Signal that never requests a stop.
     */
    StopSignal NEVER = () -> false;

    static StopSignal orNever(StopSignal signal) {
        return signal == null ? NEVER : signal;
    }
}
