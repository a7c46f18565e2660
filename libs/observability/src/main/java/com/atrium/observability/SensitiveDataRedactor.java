package com.atrium.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts credential material from maps before they are written to logs.
 * <p>
 * A key is sensitive when it contains one of the configured patterns, ignoring case, so
 * {@code password}, {@code passwordHash} and {@code adminPassword} are all caught by
 * {@code "password"}. Nested maps are redacted recursively.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "hash", "token", "secret", "authorization", "credential"
    );

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * @param patterns key fragments to treat as sensitive (case-insensitive, must not be empty)
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a new map in which sensitive values are replaced by {@value #REDACTED}.
     * Null or empty input returns an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            result.put(entry.getKey(), redactValue(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }

    @SuppressWarnings("unchecked")
    private Object redactValue(String key, Object value) {
        if (isSensitive(key)) {
            return REDACTED;
        }
        if (value instanceof Map<?, ?> nested) {
            return redact((Map<String, ?>) nested);
        }
        return value;
    }
}
