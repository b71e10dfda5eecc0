package com.sqltracing.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.semconv.ServiceAttributes;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry SDK used by {@link SqlTracing#fromEnvironment()}.
 *
 * <p>Spans are exported via OTLP to a configured endpoint (e.g. Jaeger).
 * Configuration comes from environment variables:</p>
 * <ul>
 *   <li>{@code OTEL_TRACING_ENABLED} - enable/disable tracing
 *       (default: true)</li>
 *   <li>{@code OTEL_SERVICE_NAME} - service name
 *       (default: sql-tracing)</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT} - OTLP endpoint
 *       (default: http://localhost:4317)</li>
 *   <li>{@code SQL_TRACING_TRACE_ALL} - trace every statement of every
 *       registered connectable (default: false)</li>
 * </ul>
 */
public final class TracingUtil {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        TracingUtil.class);

    /** Default service name. */
    static final String DEFAULT_SERVICE_NAME = "sql-tracing";

    /** Default OTLP endpoint. */
    static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4317";

    /** Environment variable for OTLP endpoint. */
    static final String ENV_OTLP_ENDPOINT = "OTEL_EXPORTER_OTLP_ENDPOINT";

    /** Environment variable for service name. */
    static final String ENV_SERVICE_NAME = "OTEL_SERVICE_NAME";

    /** Environment variable to enable/disable tracing. */
    static final String ENV_TRACING_ENABLED = "OTEL_TRACING_ENABLED";

    /** Environment variable for the trace-all flag. */
    static final String ENV_TRACE_ALL = "SQL_TRACING_TRACE_ALL";

    /** Instrumentation scope name for SQL statement spans. */
    public static final String SCOPE_SQL = "com.sqltracing";

    /** Singleton OpenTelemetry instance. */
    private static volatile OpenTelemetry openTelemetry;

    /** Lock for initialization. */
    private static final Object INIT_LOCK = new Object();

    /** Whether tracing is enabled. */
    private static volatile boolean tracingEnabled = true;

    /** Prevent instantiation. */
    private TracingUtil() {
        throw new AssertionError("No instances");
    }

    /**
     * Initialize OpenTelemetry if not already initialized.
     *
     * <p>Thread-safe; initializes once and returns the same instance
     * afterwards.</p>
     *
     * @return the OpenTelemetry instance
     */
    public static OpenTelemetry getOpenTelemetry() {
        if (openTelemetry == null) {
            synchronized (INIT_LOCK) {
                if (openTelemetry == null) {
                    tracingEnabled = parseTracingEnabled(System::getenv);
                    openTelemetry = initializeOpenTelemetry(tracingEnabled,
                        System::getenv);
                }
            }
        }
        return openTelemetry;
    }

    /**
     * Get a tracer for the specified instrumentation scope.
     *
     * @param scopeName the instrumentation scope name
     * @return the tracer for the given scope
     */
    public static Tracer getTracer(final String scopeName) {
        return getOpenTelemetry().getTracer(scopeName);
    }

    /**
     * Check if tracing is enabled.
     *
     * @return true if tracing is enabled, false otherwise
     */
    public static boolean isTracingEnabled() {
        getOpenTelemetry();
        return tracingEnabled;
    }

    /**
     * Read the trace-all flag from the environment.
     *
     * @return true if {@code SQL_TRACING_TRACE_ALL} is {@code true}
     */
    public static boolean isTraceAllEnabled() {
        return parseTraceAll(System::getenv);
    }

    /**
     * Parse the trace-all flag.
     *
     * @param env environment lookup
     * @return the flag, false when unset
     */
    static boolean parseTraceAll(final Function<String, String> env) {
        return Boolean.parseBoolean(getEnvOrDefault(env, ENV_TRACE_ALL,
            "false"));
    }

    /**
     * Parse the enabled flag.
     *
     * @param env environment lookup
     * @return the flag, true when unset
     */
    static boolean parseTracingEnabled(final Function<String, String> env) {
        return Boolean.parseBoolean(getEnvOrDefault(env, ENV_TRACING_ENABLED,
            "true"));
    }

    /**
     * Initialize the OpenTelemetry SDK.
     *
     * @param enabled whether tracing is enabled
     * @param env environment lookup
     * @return the configured OpenTelemetry instance, no-op when disabled
     */
    static OpenTelemetry initializeOpenTelemetry(final boolean enabled,
            final Function<String, String> env) {
        if (!enabled) {
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("OpenTelemetry tracing is disabled");
            }
            return OpenTelemetry.noop();
        }

        String serviceName = getEnvOrDefault(env, ENV_SERVICE_NAME,
            DEFAULT_SERVICE_NAME);
        String otlpEndpoint = getEnvOrDefault(env, ENV_OTLP_ENDPOINT,
            DEFAULT_OTLP_ENDPOINT);

        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Initializing OpenTelemetry with service={}, "
                + "endpoint={}", serviceName, otlpEndpoint);
        }

        SdkTracerProvider tracerProvider = createTracerProvider(serviceName,
            otlpEndpoint);
        // Flush statement spans still queued in the batch processor on exit
        Runtime.getRuntime().addShutdownHook(
            new Thread(tracerProvider::close, "sql-tracing-shutdown"));

        return OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .build();
    }

    /**
     * Build a tracer provider batching spans to an OTLP gRPC endpoint.
     *
     * @param serviceName value of the {@code service.name} resource
     *        attribute
     * @param otlpEndpoint the collector endpoint
     * @return the tracer provider; the caller owns its shutdown
     */
    static SdkTracerProvider createTracerProvider(final String serviceName,
            final String otlpEndpoint) {
        Resource resource = Resource.getDefault().toBuilder()
            .put(ServiceAttributes.SERVICE_NAME, serviceName)
            .build();
        return SdkTracerProvider.builder()
            .setResource(resource)
            .addSpanProcessor(BatchSpanProcessor.builder(
                OtlpGrpcSpanExporter.builder()
                    .setEndpoint(otlpEndpoint)
                    .build())
                .build())
            .build();
    }

    /**
     * Get environment variable or default value.
     *
     * @param env environment lookup
     * @param name environment variable name
     * @param defaultValue default value if not set
     * @return the value
     */
    private static String getEnvOrDefault(final Function<String, String> env,
            final String name, final String defaultValue) {
        String value = env.apply(name);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }

    /**
     * Shutdown the tracing system gracefully.
     * Call this when the application is shutting down.
     */
    public static void shutdown() {
        if (openTelemetry instanceof OpenTelemetrySdk sdk) {
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("Shutting down OpenTelemetry SDK");
            }
            sdk.getSdkTracerProvider().shutdown();
        }
    }
}
