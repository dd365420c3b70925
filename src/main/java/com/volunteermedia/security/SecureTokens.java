package com.volunteermedia.security;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * One-time tokens for password reset and account setup: 32 random bytes, hex encoded.
 * The first {@value #LOOKUP_PREFIX_LENGTH} characters are stored in clear as a lookup key;
 * the whole token is only kept as a BCrypt hash.
 */
public final class SecureTokens {

    public static final int TOKEN_BYTES = 32;
    public static final int LOOKUP_PREFIX_LENGTH = 16;

    private static final SecureRandom RANDOM = new SecureRandom();

    private SecureTokens() {
    }

    public static String generate() {
        byte[] bytes = new byte[TOKEN_BYTES];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public static String lookupPrefix(String token) {
        if (token == null || token.length() < LOOKUP_PREFIX_LENGTH) {
            return null;
        }
        return token.substring(0, LOOKUP_PREFIX_LENGTH);
    }
}
