package com.reportalert.common.id;

import java.security.SecureRandom;
import java.time.Clock;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Generates ULIDs (Universally Unique Lexicographically Sortable Identifiers).
 * Format: 10-char timestamp (48-bit ms since epoch) + 16-char randomness (80-bit),
 * Crockford Base32, 26 chars in total.
 *
 * <p>Table rows use {@link #prefixed(String)} so an id names its table at a glance
 * ({@code rdh_01J...} for a delivery attempt, {@code job_01J...} for a binding).
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class UlidGenerator {

    public static final int ULID_LENGTH = 26;

    private static final char[] ENCODING = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int TIMESTAMP_CHARS = 10;
    private static final int RANDOM_BYTES = 10;
    private static final SecureRandom RANDOM = new SecureRandom();

    public static String generate() {
        return generate(Clock.systemUTC());
    }

    public static String generate(Clock clock) {
        var randomness = new byte[RANDOM_BYTES];
        RANDOM.nextBytes(randomness);
        return encode(clock.millis(), randomness);
    }

    public static String prefixed(String prefix) {
        return prefix + "_" + generate();
    }

    static String encode(long timestamp, byte[] randomness) {
        var chars = new char[ULID_LENGTH];

        for (int i = TIMESTAMP_CHARS - 1; i >= 0; i--) {
            chars[i] = ENCODING[(int) (timestamp & 0x1F)];
            timestamp >>>= 5;
        }

        // 80 random bits, consumed 5 at a time from the most significant end
        int buffer = 0;
        int bits = 0;
        int position = TIMESTAMP_CHARS;
        for (byte b : randomness) {
            buffer = (buffer << 8) | (b & 0xFF);
            bits += 8;
            while (bits >= 5) {
                bits -= 5;
                chars[position++] = ENCODING[(buffer >>> bits) & 0x1F];
            }
        }
        return new String(chars);
    }
}
