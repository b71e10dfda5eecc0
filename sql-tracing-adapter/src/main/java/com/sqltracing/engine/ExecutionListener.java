package com.sqltracing.engine;

/**
 * Callback invoked by a {@link SqlConnection} around every statement
 * and at every transaction boundary.
 *
 * <p>For each call to {@link #beforeExecute} exactly one of
 * {@link #afterExecute} or {@link #onError} follows, receiving the value
 * {@code beforeExecute} returned. Every statement inside a transaction
 * gets its own pair.</p>
 *
 * @param <T> per-execution record handed from the before hook to the
 *            after/error hook
 */
public interface ExecutionListener<T> {

    /**
     * Called immediately before a statement runs.
     *
     * @param connection the connection running the statement
     * @param statement the statement
     * @return the per-execution record passed to the matching after or
     *         error hook
     */
    T beforeExecute(SqlConnection connection, SqlStatement statement);

    /**
     * Called after a statement completed successfully.
     *
     * @param execution the record returned by {@link #beforeExecute}
     */
    void afterExecute(T execution);

    /**
     * Called after a statement failed. The error is rethrown to the caller
     * once all listeners have been notified.
     *
     * @param execution the record returned by {@link #beforeExecute}
     * @param error the failure
     */
    void onError(T execution, Throwable error);

    /**
     * Called after an explicit transaction has begun.
     *
     * @param connection the connection
     */
    default void onBegin(SqlConnection connection) {
    }

    /**
     * Called after a transaction committed, including the implicit
     * transaction of an autocommit statement.
     *
     * @param connection the connection
     */
    default void onCommit(SqlConnection connection) {
    }

    /**
     * Called after a transaction rolled back, including the implicit
     * transaction of a failed autocommit statement.
     *
     * @param connection the connection
     */
    default void onRollback(SqlConnection connection) {
    }

    /**
     * Called when the connection is closed.
     *
     * @param connection the connection
     */
    default void onClose(SqlConnection connection) {
    }
}
