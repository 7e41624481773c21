package com.tessera.eventmodel.payload;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Shared field checks for payload records. */
final class PayloadChecks {

    private PayloadChecks() {
        // utility class
    }

    static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    static void requireText(List<String> errors, String field, String value) {
        if (isBlank(value)) {
            errors.add(field + " must not be null or blank");
        }
    }

    static void requireUuid(List<String> errors, String field, String value) {
        if (isBlank(value)) {
            errors.add(field + " must not be null or blank");
        } else if (!isUuid(value)) {
            errors.add(field + " must be a UUID");
        }
    }

    static void optionalUuid(List<String> errors, String field, String value) {
        if (value != null && !isUuid(value)) {
            errors.add(field + " must be a UUID");
        }
    }

    static void optionalPositive(List<String> errors, String field, Long value) {
        if (value != null && value < 1) {
            errors.add(field + " must be >= 1");
        }
    }

    static List<String> copyOrEmpty(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    static Map<String, Object> copyOrEmpty(Map<String, Object> values) {
        return values == null
                ? Map.of()
                : java.util.Collections.unmodifiableMap(new java.util.LinkedHashMap<>(values));
    }

    private static boolean isUuid(String value) {
        try {
            UUID.fromString(value);
            return value.length() == 36;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
