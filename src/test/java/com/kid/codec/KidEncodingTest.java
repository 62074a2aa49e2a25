package com.kid.codec;

import com.kid.KidVectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class KidEncodingTest {

    @Test
    @DisplayName("Should encode known values")
    void shouldEncodeKnownValues() {
        for (KidVectors.Vector v : KidVectors.VALID) {
            assertEquals(v.encoded(), KidEncoding.encode(v.bytes()), "Encoding of " + Arrays.toString(v.bytes()));
        }
    }

    @Test
    @DisplayName("Should decode known values")
    void shouldDecodeKnownValues() {
        for (KidVectors.Vector v : KidVectors.VALID) {
            byte[] dst = new byte[KidEncoding.RAW_LENGTH];
            assertTrue(KidEncoding.decode(v.encoded(), dst), "Should accept " + v.encoded());
            assertArrayEquals(v.bytes(), dst, "Decoding of " + v.encoded());
        }
    }

    @Test
    @DisplayName("All-zero and all-one values map to the first and last symbol")
    void extremesMapToFirstAndLastSymbol() {
        assertEquals("0000000000000000", KidEncoding.encode(new byte[10]));
        byte[] ones = new byte[10];
        Arrays.fill(ones, (byte) 0xFF);
        assertEquals("zzzzzzzzzzzzzzzz", KidEncoding.encode(ones));
    }

    @Test
    @DisplayName("Should reject invalid text and zero the destination")
    void shouldRejectInvalidTextAndZeroDestination() {
        for (String invalid : KidVectors.INVALID) {
            byte[] dst = new byte[KidEncoding.RAW_LENGTH];
            Arrays.fill(dst, (byte) 0x55);
            assertFalse(KidEncoding.decode(invalid, dst), "Should reject " + invalid);
            assertArrayEquals(new byte[KidEncoding.RAW_LENGTH], dst, "Destination should be zeroed for " + invalid);
            assertFalse(KidEncoding.isValid(invalid));
        }
    }

    @Test
    @DisplayName("Should reject null input")
    void shouldRejectNull() {
        assertFalse(KidEncoding.isValid(null));
        assertFalse(KidEncoding.decode(null, new byte[KidEncoding.RAW_LENGTH]));
    }

    @Test
    @DisplayName("Alphabet excludes a, i, o and u and is in ascending order")
    void alphabetIsOrderedAndExcludesVowels() {
        String alphabet = KidEncoding.ALPHABET;
        assertEquals(32, alphabet.length());
        for (char vowel : new char[]{'a', 'i', 'o', 'u'}) {
            assertEquals(-1, alphabet.indexOf(vowel), "Alphabet must not contain " + vowel);
        }
        for (int i = 1; i < alphabet.length(); i++) {
            assertTrue(alphabet.charAt(i - 1) < alphabet.charAt(i), "Alphabet must be strictly ascending at " + i);
        }
    }

    @Test
    @DisplayName("Decode inverts encode for random values")
    void decodeInvertsEncode() {
        Random random = new Random(12345L);
        byte[] src = new byte[KidEncoding.RAW_LENGTH];
        byte[] dst = new byte[KidEncoding.RAW_LENGTH];
        for (int i = 0; i < 1000; i++) {
            random.nextBytes(src);
            String encoded = KidEncoding.encode(src);
            assertTrue(KidEncoding.decode(encoded, dst));
            assertArrayEquals(src, dst, "Round trip of " + encoded);
        }
    }

    @Test
    @DisplayName("Encode inverts decode for random valid strings")
    void encodeInvertsDecode() {
        Random random = new Random(54321L);
        char[] text = new char[KidEncoding.ENCODED_LENGTH];
        byte[] raw = new byte[KidEncoding.RAW_LENGTH];
        for (int i = 0; i < 1000; i++) {
            for (int j = 0; j < text.length; j++) {
                text[j] = KidEncoding.ALPHABET.charAt(random.nextInt(32));
            }
            String candidate = new String(text);
            assertTrue(KidEncoding.decode(candidate, raw), "Should accept " + candidate);
            assertEquals(candidate, KidEncoding.encode(raw));
        }
    }

    @Test
    @DisplayName("String order agrees with unsigned byte order")
    void stringOrderAgreesWithByteOrder() {
        Random random = new Random(777L);
        byte[] a = new byte[KidEncoding.RAW_LENGTH];
        byte[] b = new byte[KidEncoding.RAW_LENGTH];
        for (int i = 0; i < 1000; i++) {
            random.nextBytes(a);
            random.nextBytes(b);
            // share a random-length prefix so that late bytes decide some comparisons
            System.arraycopy(a, 0, b, 0, random.nextInt(KidEncoding.RAW_LENGTH));
            int byteOrder = Integer.signum(Arrays.compareUnsigned(a, b));
            int textOrder = Integer.signum(KidEncoding.encode(a).compareTo(KidEncoding.encode(b)));
            assertEquals(byteOrder, textOrder, "Order mismatch for " + KidEncoding.encode(a) + " / " + KidEncoding.encode(b));
        }
    }

    @Test
    @DisplayName("Should reject wrongly sized buffers")
    void shouldRejectWronglySizedBuffers() {
        assertThrows(IllegalArgumentException.class, () -> KidEncoding.encode(new byte[9]));
        assertThrows(IllegalArgumentException.class, () -> KidEncoding.encode(new byte[10], new char[15]));
        assertThrows(IllegalArgumentException.class, () -> KidEncoding.decode("0000000000000000", new byte[11]));
    }

    @Test
    @DisplayName("Encode should write into a larger buffer without touching the tail")
    void encodeShouldWriteIntoLargerBuffer() {
        char[] dst = new char[18];
        Arrays.fill(dst, '-');
        KidEncoding.encode(KidVectors.bytes(0x01, 0x95, 0x76, 0xe1, 0x3d, 0xae, 0x00, 0x98, 0x7a, 0xe5), dst);
        assertEquals("06bqer9xnr09hyq5--", new String(dst));
    }
}
