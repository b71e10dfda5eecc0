package com.sqltracing.tracing;

import com.sqltracing.engine.SqlConnection;
import com.sqltracing.engine.SqlStatement;
import io.opentelemetry.api.trace.Span;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Record of one statement execution, handed from the before hook to the
 * matching after or error hook.
 *
 * <p>The transition out of {@link ExecutionState#SPAN_ACTIVE} happens at
 * most once, so the span is finished at most once even if a hook is
 * invoked again.</p>
 */
public final class StatementExecution {

    /** The connection running the statement. */
    private final SqlConnection connection;

    /** The statement. */
    private final SqlStatement statement;

    /** Current state. */
    private final AtomicReference<ExecutionState> state =
        new AtomicReference<>(ExecutionState.NOT_STARTED);

    /** The in-flight span, null unless a span was started. */
    private volatile Span span;

    StatementExecution(final SqlConnection connection,
            final SqlStatement statement) {
        this.connection = connection;
        this.statement = statement;
    }

    public SqlConnection getConnection() {
        return connection;
    }

    public SqlStatement getStatement() {
        return statement;
    }

    public List<Object> getParameters() {
        return statement.getParameters();
    }

    public ExecutionState getState() {
        return state.get();
    }

    /**
     * Get the span started for this execution.
     *
     * @return the span, or null if the execution was skipped
     */
    public Span getSpan() {
        return span;
    }

    void activate(final Span started) {
        span = started;
        state.set(ExecutionState.SPAN_ACTIVE);
    }

    void skip() {
        state.compareAndSet(ExecutionState.NOT_STARTED,
            ExecutionState.SKIPPED);
    }

    /**
     * Claim the right to finish the span.
     *
     * @return true for exactly one caller while the span is active
     */
    boolean markFinished() {
        return state.compareAndSet(ExecutionState.SPAN_ACTIVE,
            ExecutionState.FINISHED);
    }
}
