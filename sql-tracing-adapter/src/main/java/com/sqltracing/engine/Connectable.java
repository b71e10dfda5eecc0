package com.sqltracing.engine;

/**
 * An engine or connection that can have {@link ExecutionListener}s
 * attached.
 *
 * <p>Identity is object identity; implementations do not override
 * {@code equals}.</p>
 */
public interface Connectable {

    /**
     * Attach a listener. Attaching the same listener twice has no effect.
     *
     * @param listener the listener
     */
    void addExecutionListener(ExecutionListener<?> listener);

    /**
     * Detach a listener.
     *
     * @param listener the listener
     */
    void removeExecutionListener(ExecutionListener<?> listener);

    /**
     * Get a human readable name for logging.
     *
     * @return the name
     */
    String name();
}
