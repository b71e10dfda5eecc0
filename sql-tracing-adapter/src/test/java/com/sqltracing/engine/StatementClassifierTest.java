package com.sqltracing.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StatementClassifier.
 */
public class StatementClassifierTest {

    @Test
    @DisplayName("Test basic DML keywords")
    public void testDml() {
        assertEquals(StatementKind.INSERT, StatementClassifier.classify(
            "INSERT INTO users (name) VALUES (?)"));
        assertEquals(StatementKind.SELECT, StatementClassifier.classify(
            "select * from users"));
        assertEquals(StatementKind.UPDATE, StatementClassifier.classify(
            "Update users SET name = ?"));
        assertEquals(StatementKind.DELETE, StatementClassifier.classify(
            "DELETE FROM users"));
    }

    @Test
    @DisplayName("Test DDL with modifiers")
    public void testDdl() {
        assertEquals(StatementKind.CREATE_TABLE, StatementClassifier.classify(
            "CREATE TABLE users (id INTEGER)"));
        assertEquals(StatementKind.CREATE_TABLE, StatementClassifier.classify(
            "create temporary table t (id int)"));
        assertEquals(StatementKind.CREATE_INDEX, StatementClassifier.classify(
            "CREATE UNIQUE INDEX ix ON users (name)"));
        assertEquals(StatementKind.DROP_TABLE, StatementClassifier.classify(
            "DROP TABLE users"));
        assertEquals(StatementKind.DROP_INDEX, StatementClassifier.classify(
            "drop index ix"));
    }

    @Test
    @DisplayName("Test leading whitespace and comments are skipped")
    public void testLeadingComments() {
        assertEquals(StatementKind.SELECT, StatementClassifier.classify(
            "  -- fetch everything\n  /* block\n comment */ SELECT 1"));
        assertEquals(StatementKind.SELECT, StatementClassifier.classify(
            "WITH t AS (SELECT 1) SELECT * FROM t"));
    }

    @Test
    @DisplayName("Test unrecognized statements fall back to generic")
    public void testFallback() {
        assertEquals(StatementKind.GENERIC, StatementClassifier.classify(
            "PRAGMA foreign_keys = ON"));
        assertEquals(StatementKind.GENERIC, StatementClassifier.classify(
            "CREATE VIEW v AS SELECT 1"));
        assertEquals(StatementKind.GENERIC, StatementClassifier.classify(""));
        assertEquals(StatementKind.GENERIC, StatementClassifier.classify(null));
        assertEquals("execute", StatementKind.GENERIC.getOperationName());
    }

    @Test
    @DisplayName("Test statements carry distinct identity handles")
    public void testStatementIdentity() {
        SqlStatement first = SqlStatement.of("SELECT 1");
        SqlStatement second = SqlStatement.of("SELECT 1");

        assertNotEquals(first.getId(), second.getId());
        assertEquals(StatementKind.SELECT, first.getKind());
        assertTrue(first.getParameters().isEmpty());
    }

    @Test
    @DisplayName("Test declared kind overrides classification")
    public void testDeclaredKind() {
        SqlStatement statement = SqlStatement.of(StatementKind.INSERT,
            "REPLACE INTO users (id, name) VALUES (?, ?)", 1, "John Doe");

        assertEquals(StatementKind.INSERT, statement.getKind());
        assertEquals(2, statement.getParameters().size());
        assertThrows(UnsupportedOperationException.class,
            () -> statement.getParameters().add("x"));
    }
}
