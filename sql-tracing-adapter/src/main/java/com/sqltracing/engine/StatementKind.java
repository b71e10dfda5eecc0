package com.sqltracing.engine;

/**
 * Coarse classification of a SQL statement.
 *
 * <p>The kind determines the operation name of the span produced for
 * a traced execution.</p>
 */
public enum StatementKind {
    /** {@code CREATE TABLE}. */
    CREATE_TABLE("create_table"),
    /** {@code DROP TABLE}. */
    DROP_TABLE("drop_table"),
    /** {@code CREATE INDEX}. */
    CREATE_INDEX("create_index"),
    /** {@code DROP INDEX}. */
    DROP_INDEX("drop_index"),
    /** {@code INSERT}. */
    INSERT("insert"),
    /** {@code SELECT}, including {@code WITH ...} queries. */
    SELECT("select"),
    /** {@code UPDATE}. */
    UPDATE("update"),
    /** {@code DELETE}. */
    DELETE("delete"),
    /** Anything that could not be classified. */
    GENERIC("execute");

    /** Span operation name for this kind. */
    private final String operationName;

    StatementKind(final String operationName) {
        this.operationName = operationName;
    }

    /**
     * Get the span operation name for this kind.
     *
     * @return the operation name, e.g. {@code create_table}
     */
    public String getOperationName() {
        return operationName;
    }
}
