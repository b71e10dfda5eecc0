/**
 * OpenTelemetry tracing of SQL statement execution.
 *
 * <p>{@link com.sqltracing.tracing.SqlTracing} is the entry point. It
 * attaches a {@link com.sqltracing.tracing.SpanLifecycleManager} to every
 * registered engine or connection, which decides per statement whether a
 * span is produced, what its parent is, and finishes it on success or
 * failure. Trace markers and parent spans set on a connection last until
 * its current transaction ends.</p>
 *
 * @see com.sqltracing.tracing.TracingUtil
 */
package com.sqltracing.tracing;
