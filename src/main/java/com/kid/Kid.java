package com.kid;

import com.kid.codec.KidEncoding;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Immutable k-sortable identifier: 10 bytes, big-endian.
 *
 * <pre>
 *   bytes 0-5  milliseconds since the Unix epoch (48 bits, unsigned)
 *   bytes 6-7  sequence within the generator tick (16 bits, unsigned)
 *   bytes 8-9  random (16 bits)
 * </pre>
 *
 * The text form is 16 characters over {@link KidEncoding#ALPHABET}.
 *
 * <p>Natural ordering looks only at bytes 0-7 (timestamp and sequence), so it
 * is inconsistent with {@link #equals(Object)}: two kids that differ only in
 * their random bytes compare as 0 but are not equal.</p>
 *
 * <p>The all-zero value {@link #NIL} denotes "no id".</p>
 */
public record Kid(byte[] bytes) implements Comparable<Kid> {

    public static final int BYTES = KidEncoding.RAW_LENGTH;
    public static final int ENCODED_LENGTH = KidEncoding.ENCODED_LENGTH;

    public static final Kid NIL = new Kid(new byte[BYTES]);

    /**
     * Copies {@code bytes}; only the length is checked.
     *
     * @throws InvalidKidException if {@code bytes} is null or not 10 bytes long
     */
    public Kid {
        if (bytes == null || bytes.length != BYTES) {
            throw new InvalidKidException("kid: invalid id, expected " + BYTES + " bytes, got "
                    + (bytes == null ? "null" : bytes.length));
        }
        bytes = bytes.clone();
    }

    /**
     * Byte-array factory; same as the constructor.
     */
    public static Kid fromBytes(byte[] bytes) {
        return new Kid(bytes);
    }

    /**
     * Decodes the 16-character text form.
     *
     * @throws InvalidKidException if {@code encoded} is not a valid kid
     */
    public static Kid fromString(String encoded) {
        byte[] raw = new byte[BYTES];
        if (!KidEncoding.decode(encoded, raw)) {
            throw new InvalidKidException("kid: invalid id \"" + encoded + "\"");
        }
        return new Kid(raw);
    }

    /**
     * Non-throwing variant of {@link #fromString(String)}.
     */
    public static Optional<Kid> parse(String encoded) {
        byte[] raw = new byte[BYTES];
        if (!KidEncoding.decode(encoded, raw)) {
            return Optional.empty();
        }
        return Optional.of(new Kid(raw));
    }

    /**
     * Returns a copy of the 10 raw bytes.
     */
    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public boolean isNil() {
        return Arrays.equals(bytes, NIL.bytes);
    }

    /**
     * Alias of {@link #isNil()}.
     */
    public boolean isZero() {
        return isNil();
    }

    /**
     * Milliseconds since the Unix epoch.
     */
    public long timestamp() {
        return (bytes[0] & 0xFFL) << 40
                | (bytes[1] & 0xFFL) << 32
                | (bytes[2] & 0xFFL) << 24
                | (bytes[3] & 0xFFL) << 16
                | (bytes[4] & 0xFFL) << 8
                | (bytes[5] & 0xFFL);
    }

    /**
     * The timestamp as a UTC instant with millisecond resolution.
     */
    public Instant time() {
        return Instant.ofEpochMilli(timestamp());
    }

    public int sequence() {
        return (bytes[6] & 0xFF) << 8 | (bytes[7] & 0xFF);
    }

    public int random() {
        return (bytes[8] & 0xFF) << 8 | (bytes[9] & 0xFF);
    }

    /**
     * Writes the 16-character text form into {@code dst}.
     */
    public char[] encode(char[] dst) {
        KidEncoding.encode(bytes, dst);
        return dst;
    }

    /**
     * Compares timestamp and sequence only; returns -1, 0 or 1.
     */
    @Override
    public int compareTo(Kid other) {
        return Long.compareUnsigned(orderingKey(), other.orderingKey());
    }

    /**
     * Sorts in place by {@link #compareTo(Kid)}. The sort is stable.
     */
    public static void sort(List<Kid> kids) {
        kids.sort(null);
    }

    /**
     * Sorts in place by {@link #compareTo(Kid)}. The sort is stable.
     */
    public static void sort(Kid[] kids) {
        Arrays.sort(kids);
    }

    // bytes 0-7 as one unsigned big-endian value
    private long orderingKey() {
        long key = 0;
        for (int i = 0; i < 8; i++) {
            key = (key << 8) | (bytes[i] & 0xFFL);
        }
        return key;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Kid other = (Kid) obj;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    /**
     * The 16-character text form.
     */
    @Override
    public String toString() {
        return KidEncoding.encode(bytes);
    }
}
