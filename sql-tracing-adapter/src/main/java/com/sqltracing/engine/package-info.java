/**
 * Thin JDBC execution layer that notifies
 * {@link com.sqltracing.engine.ExecutionListener}s around every statement
 * and transaction boundary.
 */
package com.sqltracing.engine;
