package com.kid;

import com.kid.util.SystemClock;

import java.security.SecureRandom;
import java.util.random.RandomGenerator;

/**
 * Creates new kids.
 *
 * Each kid takes one tick from the shared {@link TickGenerator} for its
 * timestamp and sequence, then two random bytes. Only the tick is taken under
 * a lock; packing and the random fill happen outside it.
 *
 * <p>Successive calls return kids whose timestamp and sequence strictly
 * increase, so {@code next().compareTo(previous) > 0} always holds for kids
 * from the same generator.</p>
 */
public class KidGenerator {
    private final TickGenerator ticks;
    private final RandomGenerator random;

    /**
     * System clock and {@link SecureRandom}.
     */
    public KidGenerator() {
        this(new TickGenerator(new SystemClock()), new SecureRandom());
    }

    public KidGenerator(TickGenerator ticks, RandomGenerator random) {
        this.ticks = ticks;
        this.random = random;
    }

    /**
     * Generates a new kid. Never fails.
     */
    public Kid next() {
        Tick tick = ticks.next();
        long milli = tick.milli();
        int seq = tick.sequence();
        int rnd = random.nextInt();

        byte[] raw = new byte[Kid.BYTES];
        raw[0] = (byte) (milli >>> 40);
        raw[1] = (byte) (milli >>> 32);
        raw[2] = (byte) (milli >>> 24);
        raw[3] = (byte) (milli >>> 16);
        raw[4] = (byte) (milli >>> 8);
        raw[5] = (byte) milli;
        raw[6] = (byte) (seq >>> 8);
        raw[7] = (byte) seq;
        raw[8] = (byte) (rnd >>> 8);
        raw[9] = (byte) rnd;
        return new Kid(raw);
    }
}
