package com.sqltracing.engine;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An executable SQL statement: literal text, positional parameters and
 * its {@link StatementKind}.
 *
 * <p>Every instance carries a unique {@link #getId() identity handle}.
 * Two statements with identical text are still distinct statements, so
 * marking one of them as traced does not affect the other.</p>
 */
public final class SqlStatement {

    /** Source of identity handles. */
    private static final AtomicLong NEXT_ID = new AtomicLong();

    /** Identity handle. */
    private final long id;

    /** Statement kind. */
    private final StatementKind kind;

    /** Literal SQL text. */
    private final String sql;

    /** Positional parameters. */
    private final List<Object> parameters;

    private SqlStatement(final StatementKind kind, final String sql,
            final Object[] parameters) {
        this.id = NEXT_ID.incrementAndGet();
        this.kind = Objects.requireNonNull(kind, "kind");
        this.sql = Objects.requireNonNull(sql, "sql");
        this.parameters = parameters == null || parameters.length == 0
            ? Collections.emptyList()
            : Collections.unmodifiableList(Arrays.asList(parameters.clone()));
    }

    /**
     * Create a statement, classifying its kind from the SQL text.
     *
     * @param sql the SQL text
     * @param parameters positional parameters bound to {@code ?} markers
     * @return the statement
     */
    public static SqlStatement of(final String sql,
            final Object... parameters) {
        return new SqlStatement(StatementClassifier.classify(sql), sql,
            parameters);
    }

    /**
     * Create a statement with a declared kind.
     *
     * @param kind the statement kind
     * @param sql the SQL text
     * @param parameters positional parameters bound to {@code ?} markers
     * @return the statement
     */
    public static SqlStatement of(final StatementKind kind, final String sql,
            final Object... parameters) {
        return new SqlStatement(kind, sql, parameters);
    }

    /**
     * Get the identity handle of this statement.
     *
     * @return a value unique to this instance within the process
     */
    public long getId() {
        return id;
    }

    /**
     * Get the statement kind.
     *
     * @return the kind
     */
    public StatementKind getKind() {
        return kind;
    }

    /**
     * Get the literal SQL text.
     *
     * @return the SQL text
     */
    public String getSql() {
        return sql;
    }

    /**
     * Get the positional parameters.
     *
     * @return an unmodifiable list, empty when there are none
     */
    public List<Object> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return "SqlStatement{id=" + id + ", kind=" + kind + ", sql=" + sql
            + "}";
    }
}
