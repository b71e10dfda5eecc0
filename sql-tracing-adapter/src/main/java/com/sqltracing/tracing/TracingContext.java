package com.sqltracing.tracing;

import io.opentelemetry.api.trace.Tracer;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The active tracer and the trace-all flag.
 *
 * <p>Both values are replaced together by {@link #init(Tracer, boolean)},
 * so a hook always sees a consistent pair. Spans started from a previous
 * tracer are unaffected by re-initialization.</p>
 */
public final class TracingContext {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        TracingContext.class);

    /** Current tracer and flag. */
    private volatile Settings settings = Settings.UNINITIALIZED;

    /**
     * Set the active tracer and the trace-all flag, replacing any
     * previous values.
     *
     * @param tracer the tracer
     * @param traceAll whether every statement on every registered
     *        connectable is traced
     */
    public void init(final Tracer tracer, final boolean traceAll) {
        settings = new Settings(Objects.requireNonNull(tracer, "tracer"),
            traceAll);
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("SQL tracing initialized (traceAll={})", traceAll);
        }
    }

    /**
     * Check whether {@link #init} has been called.
     *
     * @return true once a tracer is set
     */
    public boolean isInitialized() {
        return settings.tracer() != null;
    }

    /**
     * Get the active tracer.
     *
     * @return the tracer, or null before initialization
     */
    public Tracer getTracer() {
        return settings.tracer();
    }

    /**
     * Check the trace-all flag.
     *
     * @return true if every statement is traced
     */
    public boolean isTraceAll() {
        return settings.traceAll();
    }

    /**
     * Get the current tracer and flag as one consistent value.
     */
    Settings snapshot() {
        return settings;
    }

    /**
     * Immutable tracer and flag pair.
     *
     * @param tracer the tracer, null before initialization
     * @param traceAll the trace-all flag
     */
    record Settings(Tracer tracer, boolean traceAll) {
        /** Value before initialization. */
        static final Settings UNINITIALIZED = new Settings(null, false);
    }
}
