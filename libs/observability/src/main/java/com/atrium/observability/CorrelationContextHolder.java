package com.atrium.observability;

import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * Setting a context populates the MDC keys {@code correlationId}, {@code organizationId},
 * {@code adminId} and {@code operation}; clearing removes them. Null values remove the key
 * instead of writing the string "null".
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @param context the correlation context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Runs {@code work} with {@code context} installed, then restores whatever context the
     * thread had before (or clears it).
     *
     * @return the value produced by {@code work}
     */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> work) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /**
     * {@link Runnable} variant of {@link #callWithContext(CorrelationContext, Supplier)}.
     */
    public static void runWithContext(CorrelationContext context, Runnable work) {
        callWithContext(context, () -> {
            work.run();
            return null;
        });
    }

    /**
     * Replaces the current context with {@code updated} if one is installed; no-op otherwise.
     * Used to enrich MDC mid-operation (e.g. after a token reveals the administrator).
     */
    public static void update(UnaryOperator<CorrelationContext> updated) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(updated.apply(current));
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_ORGANIZATION_ID, ctx.organizationId());
        setMdc(CorrelationContext.MDC_ADMIN_ID, ctx.adminId());
        setMdc(CorrelationContext.MDC_OPERATION, ctx.operation());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_ORGANIZATION_ID);
        MDC.remove(CorrelationContext.MDC_ADMIN_ID);
        MDC.remove(CorrelationContext.MDC_OPERATION);
    }
}
