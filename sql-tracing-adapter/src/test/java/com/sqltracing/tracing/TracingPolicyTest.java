package com.sqltracing.tracing;

import com.sqltracing.engine.SqlConnection;
import com.sqltracing.engine.SqlStatement;
import java.lang.ref.WeakReference;
import java.sql.Connection;
import java.sql.SQLException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for TracingPolicy.
 */
public class TracingPolicyTest {

    private ConnectableRegistry registry;
    private TracingPolicy policy;
    private SqlConnection connection;

    @BeforeEach
    public void setUp() throws SQLException {
        registry = new ConnectableRegistry();
        policy = new TracingPolicy(registry);
        connection = SqlConnection.wrap(mock(Connection.class));
    }

    @Test
    @DisplayName("Test decision rule")
    public void testShouldTrace() {
        registry.register(connection);
        SqlStatement statement = SqlStatement.of("SELECT 1");

        assertFalse(policy.shouldTrace(false, connection, statement));
        assertTrue(policy.shouldTrace(true, connection, statement));

        policy.setTraced(statement);
        assertTrue(policy.shouldTrace(false, connection, statement));
        policy.clearTraced(statement);
        assertFalse(policy.shouldTrace(false, connection, statement));

        assertTrue(policy.setTraced(connection));
        assertTrue(policy.shouldTrace(false, connection, statement));
    }

    @Test
    @DisplayName("Test statement marks are per object")
    public void testStatementIdentity() {
        SqlStatement marked = SqlStatement.of("SELECT 1");
        SqlStatement sameText = SqlStatement.of("SELECT 1");

        policy.setTraced(marked);

        assertTrue(policy.isTraced(marked));
        assertFalse(policy.isTraced(sameText));
        assertFalse(policy.isTraced((SqlStatement) null));
    }

    @Test
    @DisplayName("Test clearTraced releases the statement mark")
    public void testClearTracedReleasesMark() {
        SqlStatement first = SqlStatement.of("SELECT 1");
        SqlStatement second = SqlStatement.of("SELECT 2");

        policy.setTraced(first);
        policy.setTraced(first);
        policy.setTraced(second);
        assertEquals(2, policy.markedStatementCount());

        policy.clearTraced(first);
        policy.clearTraced(first);
        assertEquals(1, policy.markedStatementCount());
        assertTrue(policy.isTraced(second));
    }

    @Test
    @DisplayName("Test marks of unreachable statements are dropped")
    public void testUnreachableStatementMarksDropped() throws InterruptedException {
        SqlStatement kept = SqlStatement.of("SELECT 1");
        policy.setTraced(kept);
        WeakReference<SqlStatement> dropped = markAndForget(1000);

        for (int i = 0; i < 50 && policy.markedStatementCount() > 1; i++) {
            System.gc();
            Thread.sleep(20);
        }
        assumeTrue(dropped.get() == null, "statements were not collected");

        assertEquals(1, policy.markedStatementCount());
        assertTrue(policy.isTraced(kept));
    }

    @Test
    @DisplayName("Test connection mark is ignored when untracked")
    public void testUntrackedConnection() {
        assertFalse(policy.setTraced(connection));
        assertFalse(policy.isTraced(connection));
        assertEquals(0, registry.trackedStateCount());
    }

    /**
     * Mark statements without keeping them reachable.
     *
     * @param count number of statements to mark
     * @return a reference to the last one marked
     */
    private WeakReference<SqlStatement> markAndForget(final int count) {
        SqlStatement statement = null;
        for (int i = 0; i < count; i++) {
            statement = SqlStatement.of("SELECT " + i);
            policy.setTraced(statement);
        }
        return new WeakReference<>(statement);
    }
}
