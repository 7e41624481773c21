package com.tessera.observability;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts sensitive values from maps before they are logged, e.g. webhook bodies and insight
 * submissions.
 *
 * <p>A key is sensitive when it contains one of the patterns, case-insensitively. Nested maps and
 * lists are walked, so a token buried inside a payload is caught too.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS =
            Set.of("password", "token", "secret", "authorization", "apikey", "credential", "cookie");

    private final Pattern compiledPattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.compiledPattern =
                Pattern.compile(
                        String.join("|", patterns.stream().map(Pattern::quote).toList()),
                        Pattern.CASE_INSENSITIVE);
    }

    /** Returns a copy of {@code data} with every sensitive value replaced; null gives an empty map. */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach(
                (key, value) -> result.put(key, isSensitive(key) ? REDACTED : redactValue(value)));
        return result;
    }

    public boolean isSensitive(String fieldName) {
        return fieldName != null && compiledPattern.matcher(fieldName).find();
    }

    private Object redactValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            var nested = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> nested.put(String.valueOf(k), v));
            return redact(nested);
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            list.forEach(item -> copy.add(redactValue(item)));
            return copy;
        }
        return value;
    }
}
