package com.sqltracing.tracing;

import com.sqltracing.engine.Connectable;
import com.sqltracing.engine.SqlConnection;
import com.sqltracing.engine.SqlStatement;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for tracing SQL statement execution.
 *
 * <p>One instance holds the single active tracer and the trace-all flag
 * for everything registered with it; an application normally creates one
 * and shares it.</p>
 * <pre>
 * SqlTracing tracing = new SqlTracing();
 * tracing.initTracing(tracer);
 * tracing.registerConnectable(engine);
 *
 * try (SqlConnection connection = engine.connect();
 *      SqlTransaction tx = connection.begin()) {
 *     tracing.setParentSpan(connection, requestSpan);
 *     connection.execute(SqlStatement.of("INSERT INTO users (name) VALUES (?)", "John Doe"));
 *     tx.commit();
 * }
 * </pre>
 */
public final class SqlTracing {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        SqlTracing.class);

    /** Active tracer and flag. */
    private final TracingContext context = new TracingContext();

    /** Tracked connectables. */
    private final ConnectableRegistry registry = new ConnectableRegistry();

    /** Decision rule and statement marks. */
    private final TracingPolicy policy = new TracingPolicy(registry);

    /** Explicit parents. */
    private final ParentSpanResolver resolver =
        new ParentSpanResolver(registry);

    /** Hooks attached to registered connectables. */
    private final SpanLifecycleManager manager =
        new SpanLifecycleManager(context, registry, policy, resolver);

    /**
     * Create an instance initialized from the environment, see
     * {@link TracingUtil}.
     *
     * @return the instance
     */
    public static SqlTracing fromEnvironment() {
        SqlTracing tracing = new SqlTracing();
        tracing.initTracing(TracingUtil.getTracer(TracingUtil.SCOPE_SQL),
            TracingUtil.isTraceAllEnabled());
        return tracing;
    }

    /**
     * Set the active tracer; only explicitly marked executions are traced.
     *
     * @param tracer the tracer
     */
    public void initTracing(final Tracer tracer) {
        initTracing(tracer, false);
    }

    /**
     * Set the active tracer and the trace-all flag, replacing previous
     * values. Spans already in flight are still finished.
     *
     * @param tracer the tracer
     * @param traceAll whether to trace every statement
     */
    public void initTracing(final Tracer tracer, final boolean traceAll) {
        context.init(tracer, traceAll);
    }

    /**
     * Opt an engine or connection into tracing. Idempotent.
     *
     * @param connectable the engine or connection
     */
    public void registerConnectable(final Connectable connectable) {
        Objects.requireNonNull(connectable, "connectable");
        registry.register(connectable);
        connectable.addExecutionListener(manager);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Tracing enabled for {}", connectable.name());
        }
    }

    /**
     * Opt an engine or connection out of tracing and discard its state.
     * Spans already started for it are still finished.
     *
     * @param connectable the engine or connection
     */
    public void unregisterConnectable(final Connectable connectable) {
        Objects.requireNonNull(connectable, "connectable");
        connectable.removeExecutionListener(manager);
        registry.unregister(connectable);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Tracing disabled for {}", connectable.name());
        }
    }

    /**
     * Check whether an engine or connection is tracked.
     *
     * @param connectable the engine or connection
     * @return true if tracked, directly or through its engine
     */
    public boolean isRegistered(final Connectable connectable) {
        return registry.isRegistered(connectable);
    }

    /**
     * Trace every execution of this statement object, until
     * {@link #clearTraced(SqlStatement)}.
     *
     * @param statement the statement
     */
    public void setTraced(final SqlStatement statement) {
        policy.setTraced(Objects.requireNonNull(statement, "statement"));
    }

    /**
     * Trace every statement on this connection until its current
     * transaction ends. Outside a transaction this covers the next
     * autocommit statement.
     *
     * @param connection the connection, which must be tracked
     */
    public void setTraced(final SqlConnection connection) {
        policy.setTraced(Objects.requireNonNull(connection, "connection"));
    }

    /**
     * Remove the trace mark of a statement object.
     *
     * @param statement the statement
     */
    public void clearTraced(final SqlStatement statement) {
        policy.clearTraced(Objects.requireNonNull(statement, "statement"));
    }

    /**
     * Check the trace mark of a statement object.
     *
     * @param statement the statement
     * @return true if marked
     */
    public boolean isTraced(final SqlStatement statement) {
        return policy.isTraced(statement);
    }

    /**
     * Check the trace mark of a connection.
     *
     * @param connection the connection
     * @return true if marked within its current transaction
     */
    public boolean isTraced(final SqlConnection connection) {
        return policy.isTraced(connection);
    }

    /**
     * Make {@code span} the parent of every span produced on the
     * connection until its current transaction ends. Also marks the
     * connection as traced for the same period.
     *
     * @param connection the connection, which must be tracked
     * @param span the parent span
     */
    public void setParentSpan(final SqlConnection connection,
            final Span span) {
        Objects.requireNonNull(connection, "connection");
        if (resolver.setParentSpan(connection, span)) {
            policy.setTraced(connection);
        }
    }

    /**
     * Get the explicit parent span of a connection.
     *
     * @param connection the connection
     * @return the parent span, or null
     */
    public Span getParentSpan(final SqlConnection connection) {
        return resolver.resolve(connection);
    }

    /**
     * Get the tracing context.
     *
     * @return the context
     */
    public TracingContext getContext() {
        return context;
    }

    /**
     * Get the listener attached to registered connectables.
     *
     * @return the span lifecycle manager
     */
    public SpanLifecycleManager getListener() {
        return manager;
    }

    /**
     * Get the registry.
     *
     * @return the registry
     */
    ConnectableRegistry getRegistry() {
        return registry;
    }
}
