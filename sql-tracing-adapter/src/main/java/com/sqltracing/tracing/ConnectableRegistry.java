package com.sqltracing.tracing;

import com.sqltracing.engine.Connectable;
import com.sqltracing.engine.SqlConnection;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the engines and connections opted into tracing, and the
 * {@link TracingState} of each tracked connection.
 *
 * <p>A connection is tracked when it was registered itself, or when the
 * engine that opened it is registered and the connection was not
 * unregistered on its own. All operations are safe to call
 * concurrently.</p>
 */
public final class ConnectableRegistry {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        ConnectableRegistry.class);

    /** Registered engines and connections. */
    private final Set<Connectable> registered =
        ConcurrentHashMap.newKeySet();

    /** Connections unregistered while their engine stays registered. */
    private final Set<SqlConnection> excluded =
        ConcurrentHashMap.newKeySet();

    /** State of tracked connections, created on first use. */
    private final Map<SqlConnection, TracingState> states =
        new ConcurrentHashMap<>();

    /**
     * Begin tracking a connectable. Registering twice is a no-op.
     *
     * @param connectable the engine or connection
     * @return true if it was not registered before
     */
    public boolean register(final Connectable connectable) {
        boolean added = registered.add(
            Objects.requireNonNull(connectable, "connectable"));
        if (connectable instanceof SqlConnection connection) {
            added |= excluded.remove(connection);
        }
        if (added && LOGGER.isDebugEnabled()) {
            LOGGER.debug("Registered connectable: {}", connectable.name());
        }
        return added;
    }

    /**
     * Stop tracking a connectable and discard the state of every
     * connection that is no longer tracked as a result. A connection
     * opened by a registered engine is excluded from the engine's
     * registration.
     *
     * @param connectable the engine or connection
     * @return true if it was tracked
     */
    public boolean unregister(final Connectable connectable) {
        boolean removed = registered.remove(connectable);
        if (connectable instanceof SqlConnection connection
                && engineRegistered(connection)) {
            removed |= excluded.add(connection);
        }
        excluded.removeIf(connection -> !engineRegistered(connection));
        states.keySet().removeIf(connection -> !isRegistered(connection));
        if (removed && LOGGER.isDebugEnabled()) {
            LOGGER.debug("Unregistered connectable: {}", connectable.name());
        }
        return removed;
    }

    /**
     * Check whether a connectable is tracked.
     *
     * @param connectable the engine or connection
     * @return true if it is registered, or is a connection whose engine is
     *         registered and which was not unregistered itself
     */
    public boolean isRegistered(final Connectable connectable) {
        if (connectable == null) {
            return false;
        }
        if (registered.contains(connectable)) {
            return true;
        }
        return connectable instanceof SqlConnection connection
            && !excluded.contains(connection)
            && engineRegistered(connection);
    }

    /**
     * Get the state of a tracked connection, creating it on first use.
     *
     * @param connection the connection
     * @return the state, or null if the connection is not tracked
     */
    public TracingState stateFor(final SqlConnection connection) {
        if (!isRegistered(connection)) {
            return null;
        }
        TracingState state = states.computeIfAbsent(connection,
            c -> new TracingState());
        // unregister may have run since the check above
        if (!isRegistered(connection)) {
            states.remove(connection, state);
            return null;
        }
        return state;
    }

    /**
     * Get the state of a connection without creating it.
     *
     * @param connection the connection
     * @return the state, or null if none exists
     */
    public TracingState existingState(final SqlConnection connection) {
        return connection == null ? null : states.get(connection);
    }

    /**
     * Drop the state of a connection, e.g. once it is closed.
     *
     * @param connection the connection
     */
    public void discard(final SqlConnection connection) {
        if (connection != null) {
            states.remove(connection);
            excluded.remove(connection);
        }
    }

    private boolean engineRegistered(final SqlConnection connection) {
        return connection.getEngine() != null
            && registered.contains(connection.getEngine());
    }

    /**
     * Get the number of connections currently holding state.
     *
     * @return the count
     */
    public int trackedStateCount() {
        return states.size();
    }
}
