package com.weather.route.graph;

/**
 * Validation for values that end up inlined into Cypher or used as graph identity.
 */
public final class InputSanitizer {

    /** Maximum allowed length for place names and regions. */
    public static final int MAX_NAME_LENGTH = 200;

    /** Maximum allowed length for a cache key. */
    public static final int MAX_KEY_LENGTH = 512;

    /** Maximum allowed length for a serialized cache payload. */
    public static final int MAX_PAYLOAD_LENGTH = 4_000_000;

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates a place name or region.
     *
     * @throws IllegalArgumentException if blank, too long, or containing control characters
     */
    public static void validatePlaceName(String name, String field) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException(
                    field + " exceeds maximum length of " + MAX_NAME_LENGTH +
                            " characters (was " + name.length() + ")");
        }
        if (containsControlCharacters(name)) {
            throw new IllegalArgumentException(field + " must not contain control characters");
        }
    }

    /**
     * Validates a cache key.
     */
    public static void validateCacheKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Cache key must not be null or blank");
        }
        if (key.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException(
                    "Cache key exceeds maximum length of " + MAX_KEY_LENGTH + " characters");
        }
        if (containsControlCharacters(key)) {
            throw new IllegalArgumentException("Cache key must not contain control characters");
        }
    }

    /**
     * Validates a serialized payload before it is written to the graph.
     */
    public static void validatePayload(String payload) {
        if (payload != null && payload.length() > MAX_PAYLOAD_LENGTH) {
            throw new IllegalArgumentException(
                    "Payload exceeds maximum length of " + MAX_PAYLOAD_LENGTH +
                            " characters (was " + payload.length() + ")");
        }
    }

    /**
     * Validates a name used as a graph or label identifier: letters, digits, '-' and '_'.
     */
    public static void validateIdentifier(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
        if (!value.matches("^[A-Za-z0-9_-]+$")) {
            throw new IllegalArgumentException(
                    field + " must contain only alphanumeric characters, '-' and '_', got: '" + value + "'");
        }
    }

    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
