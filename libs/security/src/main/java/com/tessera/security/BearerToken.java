package com.tessera.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;
import java.util.Optional;

/** A bearer credential taken from an {@code Authorization} header. */
public record BearerToken(String value) {

    private static final String PREFIX = "bearer";

    public BearerToken {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value must not be null or blank");
        }
    }

    /**
     * Parses {@code "Bearer <token>"}, prefix matched case-insensitively.
     *
     * @return the token, or empty if the header is missing or malformed
     */
    public static Optional<BearerToken> fromHeader(String authorizationHeader) {
        if (authorizationHeader == null) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= PREFIX.length()
                || !trimmed.substring(0, PREFIX.length()).toLowerCase(Locale.ROOT).equals(PREFIX)
                || !Character.isWhitespace(trimmed.charAt(PREFIX.length()))) {
            return Optional.empty();
        }
        String token = trimmed.substring(PREFIX.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(new BearerToken(token));
    }

    /** Compares against a shared secret in constant time. */
    public boolean matches(String secret) {
        return secretsEqual(value, secret);
    }

    /** Constant-time comparison of two secrets; false when either is null. */
    public static boolean secretsEqual(String presented, String expected) {
        if (presented == null || expected == null) {
            return false;
        }
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "BearerToken[****]";
    }
}
