package com.sqltracing.engine;

import com.sqltracing.SqliteTestBase;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.*;

/**
 * Tests for SqlConnection, SqlTransaction and SqlEngine against SQLite.
 */
public class SqlConnectionTest extends SqliteTestBase {

    private ExecutionListener<String> listener;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUpListener() {
        listener = mock(ExecutionListener.class);
        when(listener.beforeExecute(any(), any())).thenReturn("execution");
    }

    @Test
    @DisplayName("Test statements run and queries return rows")
    public void testExecuteAndQuery() throws SQLException {
        try (SqlConnection connection = engine.connect()) {
            connection.execute(createUsers());
            StatementResult insert = connection.execute(insertUser("John Doe"));
            StatementResult select = connection.execute(selectUsers());

            assertEquals(1, insert.getUpdateCount());
            assertEquals(-1, select.getUpdateCount());
            List<Map<String, Object>> rows = select.getRows();
            assertEquals(1, rows.size());
            assertEquals("John Doe", rows.get(0).get("name"));
        }
    }

    @Test
    @DisplayName("Test autocommit statement is an implicit transaction")
    public void testAutocommitHooks() throws SQLException {
        engine.addExecutionListener(listener);
        SqlStatement create = createUsers();

        try (SqlConnection connection = engine.connect()) {
            connection.execute(create);

            InOrder inOrder = inOrder(listener);
            inOrder.verify(listener).beforeExecute(same(connection),
                same(create));
            inOrder.verify(listener).afterExecute("execution");
            inOrder.verify(listener).onCommit(connection);
            verify(listener, never()).onError(any(), any());
        }
        verify(listener).onClose(any());
    }

    @Test
    @DisplayName("Test failing statement notifies error hook and propagates")
    public void testErrorHookAndPropagation() throws SQLException {
        engine.execute(createUsers());
        engine.addExecutionListener(listener);

        try (SqlConnection connection = engine.connect()) {
            SQLException thrown = assertThrows(SQLException.class,
                () -> connection.execute(createUsers()));

            assertTrue(thrown.getMessage().contains("already exists"));
            verify(listener).onError(eq("execution"), same(thrown));
            verify(listener).onRollback(connection);
            verify(listener, never()).afterExecute(any());
        }
    }

    @Test
    @DisplayName("Test explicit transaction boundaries notify listeners")
    public void testTransactionHooks() throws SQLException {
        engine.addExecutionListener(listener);

        try (SqlConnection connection = engine.connect()) {
            try (SqlTransaction tx = connection.begin()) {
                assertTrue(connection.isInTransaction());
                assertTrue(tx.isActive());
                connection.execute(createUsers());
                connection.execute(insertUser("John Doe"));
                tx.commit();
                assertFalse(tx.isActive());
            }
            assertFalse(connection.isInTransaction());

            InOrder inOrder = inOrder(listener);
            inOrder.verify(listener).onBegin(connection);
            inOrder.verify(listener, times(2)).afterExecute("execution");
            inOrder.verify(listener).onCommit(connection);
            verify(listener, never()).onRollback(any());
        }
    }

    @Test
    @DisplayName("Test closing a transaction without commit rolls back")
    public void testCloseRollsBack() throws SQLException {
        engine.execute(createUsers());
        engine.addExecutionListener(listener);

        try (SqlConnection connection = engine.connect()) {
            try (SqlTransaction tx = connection.begin()) {
                connection.execute(insertUser("John Doe"));
            }
            verify(listener).onRollback(connection);
            assertFalse(connection.isInTransaction());
            assertTrue(connection.execute(selectUsers()).getRows().isEmpty());
        }
    }

    @Test
    @DisplayName("Test nested transaction not supported")
    public void testNestedTransactionNotSupported() throws SQLException {
        try (SqlConnection connection = engine.connect();
             SqlTransaction tx = connection.begin()) {
            assertThrows(UnsupportedOperationException.class,
                connection::begin);
            tx.rollback();
        }
    }

    @Test
    @DisplayName("Test commit after the transaction ended throws")
    public void testCommitAfterEnd() throws SQLException {
        try (SqlConnection connection = engine.connect()) {
            SqlTransaction tx = connection.begin();
            tx.commit();
            assertThrows(UnsupportedOperationException.class, tx::commit);
            assertThrows(UnsupportedOperationException.class, tx::rollback);
        }
    }

    @Test
    @DisplayName("Test closing a connection rolls back its open transaction")
    public void testCloseConnectionRollsBack() throws SQLException {
        engine.execute(createUsers());
        SqlConnection connection = engine.connect();
        connection.addExecutionListener(listener);
        connection.begin();
        connection.execute(insertUser("John Doe"));

        connection.close();

        assertTrue(connection.isClosed());
        verify(listener).onRollback(connection);
        verify(listener).onClose(connection);
        assertThrows(IllegalStateException.class,
            () -> connection.execute(selectUsers()));
        assertTrue(engine.execute(selectUsers()).getRows().isEmpty());
    }

    @Test
    @DisplayName("Test listener on engine and connection is notified once")
    public void testListenerDeduplicated() throws SQLException {
        engine.addExecutionListener(listener);
        engine.addExecutionListener(listener);

        try (SqlConnection connection = engine.connect()) {
            connection.addExecutionListener(listener);
            connection.execute(createUsers());
        }

        verify(listener, times(1)).beforeExecute(any(), any());
        verify(listener, times(1)).afterExecute(any());
    }

    @Test
    @DisplayName("Test removed listener is no longer notified")
    public void testRemoveListener() throws SQLException {
        engine.addExecutionListener(listener);
        engine.removeExecutionListener(listener);

        engine.execute(createUsers());

        verifyNoInteractions(listener);
    }

    @Test
    @DisplayName("Test listener failure does not break execution")
    public void testListenerFailureIgnored() throws SQLException {
        when(listener.beforeExecute(any(), any()))
            .thenThrow(new IllegalStateException("listener broke"));
        engine.addExecutionListener(listener);

        StatementResult result = engine.execute(createUsers());

        assertNotNull(result);
        verify(listener, never()).afterExecute(any());
    }

    @Test
    @DisplayName("Test error hook failure is suppressed on the original error")
    public void testErrorHookFailureSuppressed() throws SQLException {
        engine.execute(createUsers());
        IllegalStateException hookFailure =
            new IllegalStateException("hook broke");
        doThrow(hookFailure).when(listener).onError(any(), any());
        engine.addExecutionListener(listener);

        SQLException thrown = assertThrows(SQLException.class,
            () -> engine.execute(createUsers()));

        assertSame(hookFailure, thrown.getSuppressed()[0]);
    }

    @Test
    @DisplayName("Test driver Error still reaches the error hook")
    public void testDriverErrorNotifiesListeners() throws SQLException {
        Connection jdbc = mock(Connection.class);
        StackOverflowError driverFailure = new StackOverflowError("driver");
        when(jdbc.prepareStatement(anyString())).thenThrow(driverFailure);
        SqlConnection connection = SqlConnection.wrap(jdbc);
        connection.addExecutionListener(listener);

        StackOverflowError thrown = assertThrows(StackOverflowError.class,
            () -> connection.execute(selectUsers()));

        assertSame(driverFailure, thrown);
        verify(listener).onError(eq("execution"), same(driverFailure));
        verify(listener).onRollback(connection);
        verify(listener, never()).afterExecute(any());
    }

    @Test
    @DisplayName("Test wrapped standalone connection has no engine")
    public void testWrapStandalone() throws SQLException {
        try (SqlConnection engineConnection = engine.connect()) {
            assertSame(engine, engineConnection.getEngine());
        }
        try (SqlConnection connection = SqlConnection.wrap(
                DriverManager.getConnection("jdbc:sqlite:"
                    + tempDir.resolve("standalone.db")))) {
            assertNull(connection.getEngine());
            assertTrue(connection.name().startsWith("connection-"));
            connection.execute(createUsers());
        }
    }
}
