package com.dealtracker.common.id;

import java.security.SecureRandom;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Generates ULIDs: 48-bit millisecond timestamp followed by 80 random bits, encoded as
 * 26 Crockford Base32 characters. Ids generated in later milliseconds sort after earlier ones,
 * which keeps price observations and cycle ids naturally ordered in the database.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class UlidGenerator {

    private static final char[] ENCODING = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int TIMESTAMP_CHARS = 10;
    private static final int ULID_LENGTH = 26;
    private static final long MAX_TIMESTAMP = (1L << 48) - 1;
    private static final SecureRandom RANDOM = new SecureRandom();

    public static String generate() {
        return generate(Instant.now());
    }

    public static String generate(Instant at) {
        var timestamp = at.toEpochMilli();
        if (timestamp < 0 || timestamp > MAX_TIMESTAMP) {
            throw new IllegalArgumentException("Timestamp outside ULID range: " + at);
        }
        var randomness = new byte[10];
        RANDOM.nextBytes(randomness);

        var chars = new char[ULID_LENGTH];
        for (int i = TIMESTAMP_CHARS - 1; i >= 0; i--) {
            chars[i] = ENCODING[(int) (timestamp & 0x1F)];
            timestamp >>>= 5;
        }

        int buffer = 0;
        int bits = 0;
        int pos = TIMESTAMP_CHARS;
        for (byte b : randomness) {
            buffer = (buffer << 8) | (b & 0xFF);
            bits += 8;
            while (bits >= 5) {
                chars[pos++] = ENCODING[(buffer >>> (bits - 5)) & 0x1F];
                bits -= 5;
            }
        }
        return new String(chars);
    }
}
