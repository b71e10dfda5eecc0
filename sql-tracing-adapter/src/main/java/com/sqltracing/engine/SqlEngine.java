package com.sqltracing.engine;

import java.sql.SQLException;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection factory over a {@link DataSource}.
 *
 * <p>Listeners attached to an engine are notified for every connection
 * it opens, including the short-lived connections used by
 * {@link #execute(SqlStatement)}.</p>
 */
public final class SqlEngine implements Connectable {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        SqlEngine.class);

    /** Source of JDBC connections. */
    private final DataSource dataSource;

    /** Engine name. */
    private final String name;

    /** Attached listeners. */
    private final CopyOnWriteArrayList<ExecutionListener<?>> listeners =
        new CopyOnWriteArrayList<>();

    /** Counter for connection names. */
    private final AtomicLong connectionCounter = new AtomicLong();

    /**
     * Create an engine.
     *
     * @param dataSource the source of JDBC connections
     * @param name the engine name, used in logs and connection names
     */
    public SqlEngine(final DataSource dataSource, final String name) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Open a connection.
     *
     * @return the connection, in autocommit mode
     * @throws SQLException if the data source fails
     */
    public SqlConnection connect() throws SQLException {
        String connectionName = name + "#"
            + connectionCounter.incrementAndGet();
        SqlConnection connection = new SqlConnection(
            dataSource.getConnection(), this, connectionName);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Opened connection: {}", connectionName);
        }
        return connection;
    }

    /**
     * Execute one statement in autocommit mode on a short-lived
     * connection.
     *
     * @param statement the statement
     * @return the result
     * @throws SQLException if the database rejects the statement
     */
    public StatementResult execute(final SqlStatement statement)
            throws SQLException {
        try (SqlConnection connection = connect()) {
            return connection.execute(statement);
        }
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
     * Get the attached listeners.
     *
     * @return an unmodifiable snapshot
     */
    List<ExecutionListener<?>> getExecutionListeners() {
        return Collections.unmodifiableList(listeners);
    }

    @Override
    public String toString() {
        return "SqlEngine{" + name + "}";
    }
}
