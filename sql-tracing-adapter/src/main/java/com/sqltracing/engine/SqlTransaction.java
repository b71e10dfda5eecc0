package com.sqltracing.engine;

import java.sql.SQLException;

/**
 * An explicit transaction on a {@link SqlConnection}.
 *
 * <p>Use with try-with-resources: closing a transaction that was neither
 * committed nor rolled back rolls it back.</p>
 * <pre>
 * try (SqlTransaction tx = connection.begin()) {
 *     connection.execute(insert);
 *     tx.commit();
 * }
 * </pre>
 */
public final class SqlTransaction implements AutoCloseable {

    /** The connection owning this transaction. */
    private final SqlConnection connection;

    /** Whether commit or rollback was called. */
    private boolean completed = false;

    SqlTransaction(final SqlConnection connection) {
        this.connection = connection;
    }

    /**
     * Commit the transaction.
     *
     * @throws SQLException if the commit fails; the transaction is rolled
     *         back in that case
     * @throws UnsupportedOperationException if the transaction already
     *         ended
     */
    public void commit() throws SQLException {
        completed = true;
        connection.commit(this);
    }

    /**
     * Roll back the transaction.
     *
     * @throws SQLException if the rollback fails
     * @throws UnsupportedOperationException if the transaction already
     *         ended
     */
    public void rollback() throws SQLException {
        completed = true;
        connection.rollback(this);
    }

    /**
     * Check whether the transaction is still open.
     *
     * @return true until commit, rollback or close
     */
    public boolean isActive() {
        return !completed && connection.isInTransaction();
    }

    /**
     * Get the connection this transaction runs on.
     *
     * @return the connection
     */
    public SqlConnection getConnection() {
        return connection;
    }

    @Override
    public void close() throws SQLException {
        if (!completed && connection.isInTransaction()) {
            rollback();
        }
    }
}
