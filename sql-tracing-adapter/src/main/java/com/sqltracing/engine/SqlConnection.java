package com.sqltracing.engine;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A JDBC connection that notifies {@link ExecutionListener}s around every
 * statement and every transaction boundary.
 *
 * <p>Listeners attached to this connection and to the {@link SqlEngine}
 * that created it are notified; a listener attached to both is notified
 * once. Outside an explicit transaction each statement runs in
 * autocommit mode, and listeners see it as an implicit transaction:
 * {@code onCommit} follows a successful statement and
 * {@code onRollback} a failed one.</p>
 *
 * <p>Like the underlying JDBC connection, an instance is meant to be
 * driven by one logical sequence of calls at a time.</p>
 */
public final class SqlConnection implements Connectable, AutoCloseable {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        SqlConnection.class);

    /** Counter for names of wrapped standalone connections. */
    private static final AtomicLong STANDALONE_COUNTER = new AtomicLong();

    /** The wrapped JDBC connection. */
    private final Connection connection;

    /** The engine that opened this connection, or null. */
    private final SqlEngine engine;

    /** Name for logging. */
    private final String name;

    /** Listeners attached directly to this connection. */
    private final CopyOnWriteArrayList<ExecutionListener<?>> listeners =
        new CopyOnWriteArrayList<>();

    /** The open explicit transaction, or null. */
    private volatile SqlTransaction transaction;

    /** Whether {@link #close()} was called. */
    private volatile boolean closed = false;

    /**
     * Create a connection wrapper.
     *
     * @param connection the JDBC connection, switched to autocommit
     * @param engine the owning engine, or null
     * @param name name for logging
     * @throws SQLException if autocommit cannot be enabled
     */
    SqlConnection(final Connection connection, final SqlEngine engine,
            final String name) throws SQLException {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.engine = engine;
        this.name = name;
        connection.setAutoCommit(true);
    }

    /**
     * Wrap a JDBC connection that does not belong to any engine.
     *
     * @param connection the JDBC connection
     * @return the wrapper
     * @throws SQLException if autocommit cannot be enabled
     */
    public static SqlConnection wrap(final Connection connection)
            throws SQLException {
        return new SqlConnection(connection, null,
            "connection-" + STANDALONE_COUNTER.incrementAndGet());
    }

    /**
     * Get the engine that opened this connection.
     *
     * @return the engine, or null for a wrapped standalone connection
     */
    public SqlEngine getEngine() {
        return engine;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void addExecutionListener(final ExecutionListener<?> listener) {
        listeners.addIfAbsent(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeExecutionListener(
            final ExecutionListener<?> listener) {
        listeners.remove(listener);
    }

    /**
     * Check whether an explicit transaction is open.
     *
     * @return true between {@link #begin()} and commit or rollback
     */
    public boolean isInTransaction() {
        return transaction != null;
    }

    /**
     * Check whether this connection was closed.
     *
     * @return true after {@link #close()}
     */
    public boolean isClosed() {
        return closed;
    }

    /**
     * Execute a statement.
     *
     * @param statement the statement
     * @return the result
     * @throws SQLException if the database rejects the statement; the
     *         exception is the one raised by the driver
     */
    public StatementResult execute(final SqlStatement statement)
            throws SQLException {
        Objects.requireNonNull(statement, "statement");
        ensureOpen();
        boolean implicitTransaction = transaction == null;

        List<Invocation<?>> invocations = fireBefore(statement);
        StatementResult result;
        try {
            result = run(statement);
        } catch (SQLException | RuntimeException | Error e) {
            fireError(invocations, e);
            if (implicitTransaction) {
                fireBoundary(listener -> listener.onRollback(this));
            }
            throw e;
        }
        fireAfter(invocations);
        if (implicitTransaction) {
            fireBoundary(listener -> listener.onCommit(this));
        }
        return result;
    }

    /**
     * Begin an explicit transaction.
     *
     * @return the transaction; close it to roll back unless committed
     * @throws SQLException if autocommit cannot be disabled
     * @throws UnsupportedOperationException if a transaction is already
     *         open
     */
    public SqlTransaction begin() throws SQLException {
        ensureOpen();
        if (transaction != null) {
            throw new UnsupportedOperationException(
                "Nested transactions are not supported");
        }
        connection.setAutoCommit(false);
        SqlTransaction started = new SqlTransaction(this);
        transaction = started;

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Transaction started on connection: {}", name);
        }
        fireBoundary(listener -> listener.onBegin(this));
        return started;
    }

    /**
     * Commit the given transaction. Rolls back if the commit fails.
     */
    void commit(final SqlTransaction owner) throws SQLException {
        requireCurrent(owner);
        try {
            connection.commit();
        } catch (SQLException e) {
            try {
                rollback(owner);
            } catch (SQLException rollbackException) {
                e.addSuppressed(rollbackException);
            }
            throw e;
        }
        endTransaction();

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Transaction committed on connection: {}", name);
        }
        fireBoundary(listener -> listener.onCommit(this));
    }

    /**
     * Roll back the given transaction.
     */
    void rollback(final SqlTransaction owner) throws SQLException {
        requireCurrent(owner);
        SQLException failure = null;
        try {
            connection.rollback();
        } catch (SQLException e) {
            failure = e;
        }
        try {
            endTransaction();
        } catch (SQLException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Transaction rolled back on connection: {}", name);
        }
        fireBoundary(listener -> listener.onRollback(this));
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Close the connection, rolling back an open transaction first.
     *
     * @throws SQLException if the driver fails to close
     */
    @Override
    public void close() throws SQLException {
        if (closed) {
            return;
        }
        SQLException failure = null;
        SqlTransaction open = transaction;
        if (open != null) {
            try {
                rollback(open);
            } catch (SQLException e) {
                failure = e;
            }
        }
        closed = true;
        try {
            connection.close();
        } catch (SQLException e) {
            if (failure != null) {
                e.addSuppressed(failure);
            }
            failure = e;
        } finally {
            fireBoundary(listener -> listener.onClose(this));
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public String toString() {
        return "SqlConnection{" + name + "}";
    }

    private void requireCurrent(final SqlTransaction owner) {
        if (transaction == null || transaction != owner) {
            throw new UnsupportedOperationException(
                "No transaction in progress");
        }
    }

    /** Leave transaction mode; the transaction ends even if this throws. */
    private void endTransaction() throws SQLException {
        transaction = null;
        connection.setAutoCommit(true);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Connection is closed: " + name);
        }
    }

    /**
     * Run the statement through JDBC.
     */
    private StatementResult run(final SqlStatement statement)
            throws SQLException {
        try (PreparedStatement prepared = connection.prepareStatement(
                statement.getSql())) {
            List<Object> parameters = statement.getParameters();
            for (int i = 0; i < parameters.size(); i++) {
                prepared.setObject(i + 1, parameters.get(i));
            }
            if (!prepared.execute()) {
                return new StatementResult(prepared.getUpdateCount(),
                    Collections.emptyList());
            }
            List<Map<String, Object>> rows = new ArrayList<>();
            try (ResultSet resultSet = prepared.getResultSet()) {
                ResultSetMetaData metaData = resultSet.getMetaData();
                int columns = metaData.getColumnCount();
                while (resultSet.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int column = 1; column <= columns; column++) {
                        row.put(metaData.getColumnLabel(column),
                            resultSet.getObject(column));
                    }
                    rows.add(row);
                }
            }
            return new StatementResult(-1, rows);
        }
    }

    /**
     * Listeners of this connection followed by those of its engine, each
     * once.
     */
    private Set<ExecutionListener<?>> effectiveListeners() {
        Set<ExecutionListener<?>> effective = new LinkedHashSet<>(listeners);
        if (engine != null) {
            effective.addAll(engine.getExecutionListeners());
        }
        return effective;
    }

    private List<Invocation<?>> fireBefore(final SqlStatement statement) {
        Set<ExecutionListener<?>> effective = effectiveListeners();
        if (effective.isEmpty()) {
            return Collections.emptyList();
        }
        List<Invocation<?>> invocations = new ArrayList<>(effective.size());
        for (ExecutionListener<?> listener : effective) {
            try {
                invocations.add(Invocation.start(listener, this, statement));
            } catch (RuntimeException e) {
                LOGGER.warn("Execution listener {} failed before statement "
                    + "on {}: {}", listener, name, e.getMessage());
            }
        }
        return invocations;
    }

    private void fireAfter(final List<Invocation<?>> invocations) {
        for (Invocation<?> invocation : invocations) {
            try {
                invocation.after();
            } catch (RuntimeException e) {
                LOGGER.warn("Execution listener {} failed after statement "
                    + "on {}: {}", invocation.listener, name, e.getMessage());
            }
        }
    }

    private void fireError(final List<Invocation<?>> invocations,
            final Throwable error) {
        for (Invocation<?> invocation : invocations) {
            try {
                invocation.error(error);
            } catch (RuntimeException e) {
                error.addSuppressed(e);
            }
        }
    }

    private void fireBoundary(final Consumer<ExecutionListener<?>> event) {
        for (ExecutionListener<?> listener : effectiveListeners()) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                LOGGER.warn("Execution listener {} failed on transaction "
                    + "event for {}: {}", listener, name, e.getMessage());
            }
        }
    }

    /**
     * A listener paired with the record its before hook returned.
     *
     * @param <T> the listener's record type
     */
    private static final class Invocation<T> {
        /** The listener. */
        private final ExecutionListener<T> listener;

        /** Record returned by the before hook. */
        private final T execution;

        private Invocation(final ExecutionListener<T> listener,
                final T execution) {
            this.listener = listener;
            this.execution = execution;
        }

        static <T> Invocation<T> start(final ExecutionListener<T> listener,
                final SqlConnection connection,
                final SqlStatement statement) {
            return new Invocation<>(listener,
                listener.beforeExecute(connection, statement));
        }

        void after() {
            listener.afterExecute(execution);
        }

        void error(final Throwable error) {
            listener.onError(execution, error);
        }
    }
}
