package com.sqltracing.tracing;

import com.sqltracing.engine.SqlConnection;
import com.sqltracing.engine.SqlStatement;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.WeakHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an execution produces a span.
 *
 * <p>An execution is traced when trace-all is on, when its statement was
 * marked with {@link #setTraced(SqlStatement)}, or when its connection
 * was marked within the current transaction. A statement mark stays in
 * place until {@link #clearTraced(SqlStatement)} or until the statement
 * object is no longer reachable; connection marks are dropped at the next
 * transaction boundary.</p>
 */
public final class TracingPolicy {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        TracingPolicy.class);

    /** Registry holding connection state. */
    private final ConnectableRegistry registry;

    /** Marked statements, held weakly and compared by identity. */
    private final Set<SqlStatement> tracedStatements =
        Collections.synchronizedSet(
            Collections.newSetFromMap(new WeakHashMap<>()));

    /**
     * Create a policy.
     *
     * @param registry the registry holding connection state
     */
    public TracingPolicy(final ConnectableRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Mark a statement as traced for all of its executions.
     *
     * @param statement the statement
     */
    public void setTraced(final SqlStatement statement) {
        tracedStatements.add(statement);
    }

    /**
     * Remove the trace mark of a statement.
     *
     * @param statement the statement
     */
    public void clearTraced(final SqlStatement statement) {
        tracedStatements.remove(statement);
    }

    /**
     * Check the trace mark of a statement.
     *
     * @param statement the statement
     * @return true if marked
     */
    public boolean isTraced(final SqlStatement statement) {
        return statement != null
            && tracedStatements.contains(statement);
    }

    /**
     * Get the number of statement marks still held.
     *
     * @return the count, excluding statements already collected
     */
    int markedStatementCount() {
        return tracedStatements.size();
    }

    /**
     * Mark a connection as traced until its current transaction ends.
     *
     * @param connection the connection
     * @return false if the connection is not tracked and the mark was
     *         ignored
     */
    public boolean setTraced(final SqlConnection connection) {
        TracingState state = registry.stateFor(connection);
        if (state == null) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Ignoring trace mark for unregistered "
                    + "connection: {}", connection);
            }
            return false;
        }
        state.markTraced();
        return true;
    }

    /**
     * Check the trace mark of a connection.
     *
     * @param connection the connection
     * @return true if marked within its current transaction
     */
    public boolean isTraced(final SqlConnection connection) {
        TracingState state = registry.existingState(connection);
        return state != null && state.isTraced();
    }

    /**
     * Apply the decision rule.
     *
     * @param traceAll the trace-all flag
     * @param connection the connection running the statement
     * @param statement the statement
     * @return true if the execution should produce a span
     */
    public boolean shouldTrace(final boolean traceAll,
            final SqlConnection connection, final SqlStatement statement) {
        return traceAll || isTraced(statement) || isTraced(connection);
    }
}
