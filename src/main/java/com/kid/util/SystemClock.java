package com.kid.util;

import java.time.Instant;

/**
 * Production implementation of Clock that uses the system time.
 * Backed by {@link Instant#now()}, which carries microsecond precision on
 * most platforms, unlike {@link System#currentTimeMillis()}.
 */
public class SystemClock implements Clock {

    @Override
    public long nowNanos() {
        Instant now = Instant.now();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }
}
