package com.kid.util;

/**
 * Clock abstraction for time-related operations.
 * This allows for deterministic testing by providing stub implementations
 * while using system time in production.
 */
public interface Clock {

    /**
     * Returns the current wall-clock time in nanoseconds since the Unix epoch.
     * Implementations should offer sub-millisecond precision where the platform
     * has it; kid sequences are derived from the sub-millisecond part.
     *
     * @return current time in nanoseconds
     */
    long nowNanos();
}
