package com.programmewatch.common.id;

import java.security.SecureRandom;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * ULID identifiers for cycles and delivery records: 48-bit millisecond timestamp
 * followed by 80 random bits, Crockford Base32 encoded into 26 characters.
 * Ids generated in later milliseconds sort after earlier ones.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class UlidGenerator {

    private static final char[] ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int TIME_CHARS = 10;
    private static final int RANDOM_CHARS = 16;
    private static final SecureRandom RANDOM = new SecureRandom();

    static String generate() {
        return generate(Instant.now());
    }

    public static String generate(Instant at) {
        var chars = new char[TIME_CHARS + RANDOM_CHARS];
        var millis = at.toEpochMilli();
        for (int i = TIME_CHARS - 1; i >= 0; i--) {
            chars[i] = ALPHABET[(int) (millis & 0x1F)];
            millis >>>= 5;
        }

        var random = new byte[10];
        RANDOM.nextBytes(random);
        // 80 bits split into two 40-bit halves, 8 characters each
        var high = toLong(random, 0);
        var low = toLong(random, 5);
        encode40(high, chars, TIME_CHARS);
        encode40(low, chars, TIME_CHARS + 8);
        return new String(chars);
    }

    static Instant timestampOf(String ulid) {
        if (ulid == null || ulid.length() != TIME_CHARS + RANDOM_CHARS) {
            throw new IllegalArgumentException("Not a ULID: " + ulid);
        }
        long millis = 0;
        for (int i = 0; i < TIME_CHARS; i++) {
            millis = (millis << 5) | decode(ulid.charAt(i));
        }
        return Instant.ofEpochMilli(millis);
    }

    private static long toLong(byte[] bytes, int offset) {
        long value = 0;
        for (int i = offset; i < offset + 5; i++) {
            value = (value << 8) | (bytes[i] & 0xFF);
        }
        return value;
    }

    private static void encode40(long value, char[] target, int offset) {
        for (int i = offset + 7; i >= offset; i--) {
            target[i] = ALPHABET[(int) (value & 0x1F)];
            value >>>= 5;
        }
    }

    private static int decode(char c) {
        for (int i = 0; i < ALPHABET.length; i++) {
            if (ALPHABET[i] == c) {
                return i;
            }
        }
        throw new IllegalArgumentException("Invalid ULID character: " + c);
    }
}
