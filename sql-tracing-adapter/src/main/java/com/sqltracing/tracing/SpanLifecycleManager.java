package com.sqltracing.tracing;

import com.sqltracing.engine.ExecutionListener;
import com.sqltracing.engine.SqlConnection;
import com.sqltracing.engine.SqlStatement;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts, tags and finishes one span per traced statement execution.
 *
 * <p>Attached as an {@link ExecutionListener} to every registered engine
 * or connection. Each span is started in the before hook and finished by
 * whichever of the after or error hook follows. Transaction boundaries
 * drop the connection's trace marker and parent span.</p>
 *
 * <p>Hooks never throw. Tracer failures are logged and the statement
 * runs untraced.</p>
 */
public final class SpanLifecycleManager
        implements ExecutionListener<StatementExecution> {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        SpanLifecycleManager.class);

    /** Value of the component tag. */
    public static final String COMPONENT_NAME = "sql-tracing";

    /** Value of the database type tag. */
    public static final String DB_TYPE_SQL = "sql";

    /** Attribute key for the instrumenting component. */
    static final AttributeKey<String> ATTR_COMPONENT =
        AttributeKey.stringKey("component");

    /** Attribute key for the database type. */
    static final AttributeKey<String> ATTR_DB_TYPE =
        AttributeKey.stringKey("db.type");

    /** Attribute key for the SQL text. */
    static final AttributeKey<String> ATTR_DB_STATEMENT =
        AttributeKey.stringKey("db.statement");

    /** Active tracer and flag. */
    private final TracingContext context;

    /** Tracked connectables and connection state. */
    private final ConnectableRegistry registry;

    /** Decision rule. */
    private final TracingPolicy policy;

    /** Explicit parents. */
    private final ParentSpanResolver resolver;

    /** Failure path. */
    private final ErrorTagger errorTagger = new ErrorTagger();

    /**
     * Create a manager.
     *
     * @param context the tracing context
     * @param registry the registry
     * @param policy the tracing policy
     * @param resolver the parent span resolver
     */
    public SpanLifecycleManager(final TracingContext context,
            final ConnectableRegistry registry, final TracingPolicy policy,
            final ParentSpanResolver resolver) {
        this.context = Objects.requireNonNull(context, "context");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    @Override
    public StatementExecution beforeExecute(final SqlConnection connection,
            final SqlStatement statement) {
        StatementExecution execution =
            new StatementExecution(connection, statement);
        try {
            Span span = startSpan(connection, statement);
            if (span == null) {
                execution.skip();
            } else {
                execution.activate(span);
            }
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to start span for statement on {}: {}",
                connection, e.getMessage());
            execution.skip();
        }
        return execution;
    }

    @Override
    public void afterExecute(final StatementExecution execution) {
        if (execution != null && execution.markFinished()) {
            ErrorTagger.finish(execution.getSpan());
        }
    }

    @Override
    public void onError(final StatementExecution execution,
            final Throwable error) {
        if (execution != null && execution.markFinished()) {
            errorTagger.tagAndFinish(execution.getSpan(), error);
        }
    }

    @Override
    public void onBegin(final SqlConnection connection) {
        endTransactionScope(connection);
    }

    @Override
    public void onCommit(final SqlConnection connection) {
        endTransactionScope(connection);
    }

    @Override
    public void onRollback(final SqlConnection connection) {
        endTransactionScope(connection);
    }

    @Override
    public void onClose(final SqlConnection connection) {
        registry.discard(connection);
    }

    /**
     * Start a span if the execution should be traced.
     *
     * @return the started span, or null to skip
     */
    private Span startSpan(final SqlConnection connection,
            final SqlStatement statement) {
        if (!registry.isRegistered(connection)) {
            return null;
        }
        TracingContext.Settings settings = context.snapshot();
        if (settings.tracer() == null) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("SQL tracing not initialized, skipping "
                    + "statement on {}", connection);
            }
            return null;
        }
        if (!policy.shouldTrace(settings.traceAll(), connection, statement)) {
            return null;
        }

        SpanBuilder builder = settings.tracer()
            .spanBuilder(statement.getKind().getOperationName())
            .setSpanKind(SpanKind.CLIENT)
            .setAttribute(ATTR_COMPONENT, COMPONENT_NAME)
            .setAttribute(ATTR_DB_TYPE, DB_TYPE_SQL)
            .setAttribute(ATTR_DB_STATEMENT, statement.getSql());
        Context parent = resolver.parentContext(connection);
        if (parent != null) {
            builder.setParent(parent);
        }
        return builder.startSpan();
    }

    /**
     * Drop the trace marker and parent span of a connection.
     */
    private void endTransactionScope(final SqlConnection connection) {
        TracingState state = registry.existingState(connection);
        if (state != null) {
            state.clear();
        }
    }
}
