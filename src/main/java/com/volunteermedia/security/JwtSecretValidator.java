package com.volunteermedia.security;

import java.util.List;
import java.util.Locale;

/**
 * Startup check for the JWT signing secret.
 *
 * Rejects secrets that are short, low in variety, or look like a copied placeholder.
 */
public final class JwtSecretValidator {

    static final int MIN_LENGTH = 32;
    static final int MIN_DISTINCT_CHARS = 11;
    private static final List<String> PLACEHOLDER_MARKERS = List.of("change", "example", "test", "default");

    private JwtSecretValidator() {
    }

    public static void validate(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret is not configured (set JWT_SECRET)");
        }
        if (secret.length() < MIN_LENGTH) {
            throw new IllegalStateException("JWT secret must be at least " + MIN_LENGTH + " characters long");
        }
        String lower = secret.toLowerCase(Locale.ROOT);
        for (String marker : PLACEHOLDER_MARKERS) {
            if (lower.contains(marker)) {
                throw new IllegalStateException("JWT secret appears to be a placeholder value (contains '" + marker + "')");
            }
        }
        long distinct = secret.chars().distinct().count();
        if (distinct < MIN_DISTINCT_CHARS) {
            throw new IllegalStateException("JWT secret has too little entropy (only " + distinct + " distinct characters)");
        }
    }
}
