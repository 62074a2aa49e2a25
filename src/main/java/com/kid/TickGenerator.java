package com.kid;

import com.kid.util.Clock;

/**
 * Issues strictly increasing (millisecond, sequence) pairs.
 *
 * <p>The sequence is the sub-millisecond remainder of the clock reading
 * shifted right by 8, which lands in 0..3906. When a reading does not move
 * past the last issued tick (same bucket, stalled or backwards clock) the
 * generator issues {@code lastTick + 1} instead, carrying into the millisecond
 * once the 12-bit sequence is exhausted. Under sustained bursts the reported
 * timestamp can therefore run ahead of the wall clock.</p>
 *
 * <p>Thread-safe. The read-compare-update runs under this instance's monitor,
 * and nothing else is shared, so one instance should be created per process
 * and handed to every caller.</p>
 */
public class TickGenerator {

    static final int SEQUENCE_BITS = 12;
    private static final long SEQUENCE_MASK = (1L << SEQUENCE_BITS) - 1;
    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final Clock clock;

    // milli << 12 | seq of the last issued tick
    private long lastTick;

    public TickGenerator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns a tick whose {@link Tick#value()} is greater than that of every
     * tick previously returned by this generator.
     */
    public Tick next() {
        synchronized (this) {
            long nanos = clock.nowNanos();
            long milli = nanos / NANOS_PER_MILLI;
            long seq = (nanos - milli * NANOS_PER_MILLI) >> 8;
            long now = (milli << SEQUENCE_BITS) + seq;
            if (now <= lastTick) {
                now = lastTick + 1;
                milli = now >> SEQUENCE_BITS;
                seq = now & SEQUENCE_MASK;
            }
            lastTick = now;
            return new Tick(milli, (int) seq);
        }
    }
}
