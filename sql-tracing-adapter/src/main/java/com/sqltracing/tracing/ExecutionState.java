package com.sqltracing.tracing;

/**
 * Lifecycle of a {@link StatementExecution}.
 *
 * <pre>
 * NOT_STARTED -&gt; SPAN_ACTIVE -&gt; FINISHED
 * NOT_STARTED -&gt; SKIPPED
 * </pre>
 */
public enum ExecutionState {
    /** Before hook has not decided yet. */
    NOT_STARTED,
    /** A span was started and is in flight. */
    SPAN_ACTIVE,
    /** The span was finished. */
    FINISHED,
    /** No span was created. */
    SKIPPED
}
