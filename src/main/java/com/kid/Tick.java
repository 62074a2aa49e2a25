package com.kid;

/**
 * One issued (timestamp, sequence) pair.
 *
 * @param milli    milliseconds since the Unix epoch
 * @param sequence 12-bit sequence, 0..4095
 */
public record Tick(long milli, int sequence) {

    /**
     * The combined ordering value {@code milli << 12 | sequence}.
     */
    public long value() {
        return (milli << TickGenerator.SEQUENCE_BITS) + sequence;
    }
}
