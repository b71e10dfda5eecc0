package com.sqltracing.tracing;

import io.opentelemetry.api.trace.Span;

/**
 * Tracing state of one connection, valid for its current transaction.
 */
public final class TracingState {

    /** Explicit parent for spans of this connection, or null. */
    private volatile Span parentSpan;

    /** Whether the connection was explicitly marked as traced. */
    private volatile boolean traced = false;

    /**
     * Get the explicit parent span.
     *
     * @return the parent span, or null
     */
    public Span getParentSpan() {
        return parentSpan;
    }

    /**
     * Check the explicit trace marker.
     *
     * @return true if the connection is marked as traced
     */
    public boolean isTraced() {
        return traced;
    }

    void setParentSpan(final Span span) {
        this.parentSpan = span;
    }

    void markTraced() {
        this.traced = true;
    }

    /** Drop the marker and the parent span at a transaction boundary. */
    void clear() {
        traced = false;
        parentSpan = null;
    }
}
