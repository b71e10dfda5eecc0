package com.sqltracing.tracing;

import com.sqltracing.engine.SqlConnection;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Context;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a connection to a caller-supplied parent span for the duration of
 * its current transaction.
 *
 * <p>When no explicit parent is set, no parent is supplied and the span
 * builder falls back to {@link Context#current()}.</p>
 */
public final class ParentSpanResolver {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        ParentSpanResolver.class);

    /** Registry holding connection state. */
    private final ConnectableRegistry registry;

    /**
     * Create a resolver.
     *
     * @param registry the registry holding connection state
     */
    public ParentSpanResolver(final ConnectableRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Set the parent of spans produced on a connection until its current
     * transaction ends.
     *
     * @param connection the connection
     * @param span the parent span
     * @return false if the connection is not tracked and the parent was
     *         ignored
     */
    public boolean setParentSpan(final SqlConnection connection,
            final Span span) {
        Objects.requireNonNull(span, "span");
        TracingState state = registry.stateFor(connection);
        if (state == null) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Ignoring parent span for unregistered "
                    + "connection: {}", connection);
            }
            return false;
        }
        state.setParentSpan(span);
        return true;
    }

    /**
     * Get the explicit parent span of a connection.
     *
     * @param connection the connection
     * @return the parent span, or null if none is set
     */
    public Span resolve(final SqlConnection connection) {
        TracingState state = registry.existingState(connection);
        return state == null ? null : state.getParentSpan();
    }

    /**
     * Get the context to start a connection's spans under.
     *
     * @param connection the connection
     * @return a context holding the explicit parent, or null to use the
     *         current context
     */
    Context parentContext(final SqlConnection connection) {
        Span parent = resolve(connection);
        return parent == null ? null : Context.current().with(parent);
    }
}
