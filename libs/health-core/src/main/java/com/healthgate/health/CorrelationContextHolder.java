package com.healthgate.health;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * When a context is set, its MDC keys are populated so every log statement on this thread
 * includes them. Probe threads come from a shared executor, so the aggregator hands the
 * caller's context over with {@link #propagate(Supplier)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // Utility class
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

    /**
     * Returns the current thread's correlation context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the correlation context and removes its MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
    }

    /**
     * Executes the supplier with the given context set, then restores the previous context
     * (or clears if there was none).
     *
     * @param context  the correlation context for the duration of the call
     * @param supplier the work to execute
     * @return the supplier's result
     */
    public static <T> T supplyWithContext(CorrelationContext context, Supplier<T> supplier) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return supplier.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /**
     * Captures the calling thread's context and returns a supplier that runs the given work
     * under it, whichever thread ends up calling it. Without a current context the work is
     * returned unchanged.
     */
    public static <T> Supplier<T> propagate(Supplier<T> supplier) {
        CorrelationContext captured = CONTEXT.get();
        if (captured == null) {
            return supplier;
        }
        return () -> supplyWithContext(captured, supplier);
    }

    private static void populateMdc(CorrelationContext ctx) {
        MDC.put(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        if (ctx.requestId() != null) {
            MDC.put(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
        } else {
            MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        }
    }
}
