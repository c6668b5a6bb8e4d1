package com.deepansh.runtime.observability;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Masks values of sensitive keys before structured data reaches the logs.
 * A key is sensitive when it ends with a configured key, ignoring case, '_' and '-'.
 * So "api_key" also covers "apiKey" and "X-Api-Key", and "token" covers "access_token".
 */
public class LogRedactor {

    public static final String MASK = "***";

    public static final List<String> DEFAULT_KEYS =
            List.of("api_key", "apiKey", "authorization", "token", "password", "secret");

    private final Set<String> sensitiveKeys;

    public LogRedactor(Collection<String> sensitiveKeys) {
        this.sensitiveKeys = sensitiveKeys.stream()
                .map(LogRedactor::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    public LogRedactor() {
        this(DEFAULT_KEYS);
    }

    public Map<String, Object> redact(Map<String, ?> values) {
        if (values == null) return Map.of();
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> copy.put(key, redactValue(key, value)));
        return copy;
    }

    public boolean isSensitive(String key) {
        if (key == null) return false;
        String normalized = normalize(key);
        return sensitiveKeys.stream().anyMatch(normalized::endsWith);
    }

    @SuppressWarnings("unchecked")
    private Object redactValue(String key, Object value) {
        if (isSensitive(key)) return MASK;
        if (value instanceof Map<?, ?> nested) {
            return redact((Map<String, ?>) nested);
        }
        if (value instanceof List<?> list) {
            return list.stream()
                    .map(item -> item instanceof Map<?, ?> m ? redact((Map<String, ?>) m) : item)
                    .toList();
        }
        return value;
    }

    private static String normalize(String key) {
        return key.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
