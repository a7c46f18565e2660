package com.atrium.common;

import java.util.Map;

/**
 * Base type for every failure reported by the tenant engine and its credential layer.
 *
 * <p>All failures are reported synchronously and none are retried internally. The
 * {@link FailureCategory} tells the calling layer how to surface the failure; the context map
 * carries the identifiers involved (slug, email, resource name) for logs and error bodies.
 */
public abstract class AtriumException extends RuntimeException {

    private final FailureCategory category;
    private final Map<String, String> context;

    protected AtriumException(FailureCategory category, String message) {
        this(category, message, Map.of(), null);
    }

    protected AtriumException(FailureCategory category, String message, Map<String, String> context) {
        this(category, message, context, null);
    }

    protected AtriumException(
            FailureCategory category, String message, Map<String, String> context, Throwable cause) {
        super(message, cause);
        if (category == null) {
            throw new IllegalArgumentException("category must not be null");
        }
        this.category = category;
        this.context = context == null ? Map.of() : Map.copyOf(context);
    }

    public FailureCategory category() {
        return category;
    }

    public Map<String, String> context() {
        return context;
    }
}
