package com.bbthechange.tripplanner.util;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.function.Predicate;

/**
 * Generates opaque, unguessable tokens for invitations, collaborator invites and share links.
 */
public final class SecureTokenGenerator {

    private static final int TOKEN_BYTES = 32;  // 256 bits
    private static final SecureRandom random = new SecureRandom();
    private static final Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();

    private SecureTokenGenerator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Generate a random URL-safe token (43 characters).
     */
    public static String generate() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return encoder.encodeToString(bytes);
    }

    /**
     * Generate a token the supplied checker does not already know about.
     * With 2^256 possible values a second iteration is practically never needed.
     *
     * @param existsChecker returns true if a token is already in use
     */
    public static String generateUnique(Predicate<String> existsChecker) {
        String token;
        do {
            token = generate();
        } while (existsChecker.test(token));
        return token;
    }
}
