package com.kid.codec;

import java.util.Arrays;

/**
 * KidEncoding
 * -----------------------------------------------------------------------------
 * Base-32 codec between the 10-byte binary kid and its 16-character text form.
 *
 * <p>The alphabet is {@code 0123456789bcdefghjklmnpqrstvwxyz}: digits and
 * lowercase letters without a, i, o and u. Symbols are listed in increasing
 * code-point order, so comparing two encoded kids as strings gives the same
 * result as comparing their bytes as unsigned numbers.</p>
 *
 * <p>80 input bits map onto exactly 16 five-bit symbols, so there is never any
 * padding. Both directions are unrolled by hand; output position 0 carries the
 * most significant five bits of byte 0.</p>
 *
 * <p>Decoding is case-sensitive. Callers that accept mixed-case input must
 * lower-case it first.</p>
 */
public final class KidEncoding {

    public static final String ALPHABET = "0123456789bcdefghjklmnpqrstvwxyz";

    /** Binary length of a kid. */
    public static final int RAW_LENGTH = 10;

    /** Encoded length of a kid. */
    public static final int ENCODED_LENGTH = 16;

    private static final char[] ENCODING = ALPHABET.toCharArray();

    /* Marks characters outside the alphabet in DECODING. */
    private static final byte INVALID = (byte) 0xFF;

    private static final byte[] DECODING = new byte[128];

    static {
        Arrays.fill(DECODING, INVALID);
        for (int i = 0; i < ENCODING.length; i++) {
            DECODING[ENCODING[i]] = (byte) i;
        }
    }

    private KidEncoding() {}

    /**
     * Encodes 10 bytes into a new 16-character string.
     */
    public static String encode(byte[] src) {
        char[] dst = new char[ENCODED_LENGTH];
        encode(src, dst);
        return new String(dst);
    }

    /**
     * Encodes 10 bytes into the first 16 slots of {@code dst}.
     *
     * @throws IllegalArgumentException if {@code src} is not 10 bytes or
     *         {@code dst} is shorter than 16 characters
     */
    public static void encode(byte[] src, char[] dst) {
        if (src.length != RAW_LENGTH) {
            throw new IllegalArgumentException("Expected " + RAW_LENGTH + " bytes, got " + src.length);
        }
        if (dst.length < ENCODED_LENGTH) {
            throw new IllegalArgumentException("Destination needs " + ENCODED_LENGTH + " chars, has " + dst.length);
        }
        final int b0 = src[0] & 0xFF;
        final int b1 = src[1] & 0xFF;
        final int b2 = src[2] & 0xFF;
        final int b3 = src[3] & 0xFF;
        final int b4 = src[4] & 0xFF;
        final int b5 = src[5] & 0xFF;
        final int b6 = src[6] & 0xFF;
        final int b7 = src[7] & 0xFF;
        final int b8 = src[8] & 0xFF;
        final int b9 = src[9] & 0xFF;

        dst[0] = ENCODING[b0 >>> 3];
        dst[1] = ENCODING[((b0 << 2) | (b1 >>> 6)) & 0x1F];
        dst[2] = ENCODING[(b1 >>> 1) & 0x1F];
        dst[3] = ENCODING[((b1 << 4) | (b2 >>> 4)) & 0x1F];
        dst[4] = ENCODING[((b2 << 1) | (b3 >>> 7)) & 0x1F];
        dst[5] = ENCODING[(b3 >>> 2) & 0x1F];
        dst[6] = ENCODING[((b3 << 3) | (b4 >>> 5)) & 0x1F];
        dst[7] = ENCODING[b4 & 0x1F];
        dst[8] = ENCODING[b5 >>> 3];
        dst[9] = ENCODING[((b5 << 2) | (b6 >>> 6)) & 0x1F];
        dst[10] = ENCODING[(b6 >>> 1) & 0x1F];
        dst[11] = ENCODING[((b6 << 4) | (b7 >>> 4)) & 0x1F];
        dst[12] = ENCODING[((b7 << 1) | (b8 >>> 7)) & 0x1F];
        dst[13] = ENCODING[(b8 >>> 2) & 0x1F];
        dst[14] = ENCODING[((b8 << 3) | (b9 >>> 5)) & 0x1F];
        dst[15] = ENCODING[b9 & 0x1F];
    }

    /**
     * Decodes a 16-character kid into {@code dst}.
     *
     * <p>On failure {@code dst} is zero-filled, never left partially
     * written.</p>
     *
     * @param src candidate text
     * @param dst receives 10 bytes
     * @return {@code true} if {@code src} is a valid encoded kid
     */
    public static boolean decode(CharSequence src, byte[] dst) {
        if (dst.length != RAW_LENGTH) {
            throw new IllegalArgumentException("Expected " + RAW_LENGTH + " byte destination, got " + dst.length);
        }
        if (!isValid(src)) {
            Arrays.fill(dst, (byte) 0);
            return false;
        }
        final int d0 = DECODING[src.charAt(0)];
        final int d1 = DECODING[src.charAt(1)];
        final int d2 = DECODING[src.charAt(2)];
        final int d3 = DECODING[src.charAt(3)];
        final int d4 = DECODING[src.charAt(4)];
        final int d5 = DECODING[src.charAt(5)];
        final int d6 = DECODING[src.charAt(6)];
        final int d7 = DECODING[src.charAt(7)];
        final int d8 = DECODING[src.charAt(8)];
        final int d9 = DECODING[src.charAt(9)];
        final int d10 = DECODING[src.charAt(10)];
        final int d11 = DECODING[src.charAt(11)];
        final int d12 = DECODING[src.charAt(12)];
        final int d13 = DECODING[src.charAt(13)];
        final int d14 = DECODING[src.charAt(14)];
        final int d15 = DECODING[src.charAt(15)];

        final int b9 = ((d14 << 5) | d15) & 0xFF;
        // the last symbol must survive a round trip
        if (ENCODING[b9 & 0x1F] != src.charAt(15)) {
            Arrays.fill(dst, (byte) 0);
            return false;
        }
        dst[9] = (byte) b9;
        dst[8] = (byte) ((d12 << 7) | (d13 << 2) | (d14 >>> 3));
        dst[7] = (byte) ((d11 << 4) | (d12 >>> 1));
        dst[6] = (byte) ((d9 << 6) | (d10 << 1) | (d11 >>> 4));
        dst[5] = (byte) ((d8 << 3) | (d9 >>> 2));
        dst[4] = (byte) ((d6 << 5) | d7);
        dst[3] = (byte) ((d4 << 7) | (d5 << 2) | (d6 >>> 3));
        dst[2] = (byte) ((d3 << 4) | (d4 >>> 1));
        dst[1] = (byte) ((d1 << 6) | (d2 << 1) | (d3 >>> 4));
        dst[0] = (byte) ((d0 << 3) | (d1 >>> 2));
        return true;
    }

    /**
     * Returns true if {@code src} has the encoded length and uses only
     * alphabet characters.
     */
    public static boolean isValid(CharSequence src) {
        if (src == null || src.length() != ENCODED_LENGTH) {
            return false;
        }
        for (int i = 0; i < ENCODED_LENGTH; i++) {
            char c = src.charAt(i);
            if (c >= DECODING.length || DECODING[c] == INVALID) {
                return false;
            }
        }
        return true;
    }
}
