package com.sqltracing.tracing;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tags a failed execution's span and finishes it.
 *
 * <p>Never throws: a failure while tagging is logged and the span is
 * still ended, so the original execution error reaches the caller
 * unchanged.</p>
 */
final class ErrorTagger {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        ErrorTagger.class);

    /** Attribute key for the error flag. */
    static final AttributeKey<String> ATTR_ERROR =
        AttributeKey.stringKey("error");

    /**
     * Tag the span with {@code error = "true"} and the error status, then
     * end it.
     *
     * @param span the in-flight span
     * @param error the execution failure, may be null
     */
    void tagAndFinish(final Span span, final Throwable error) {
        try {
            span.setAttribute(ATTR_ERROR, "true");
            if (error != null) {
                span.setStatus(StatusCode.ERROR, String.valueOf(
                    error.getMessage()));
                span.recordException(error);
            } else {
                span.setStatus(StatusCode.ERROR);
            }
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to tag span with error: {}", e.getMessage());
        } finally {
            finish(span);
        }
    }

    /**
     * End a span, logging instead of throwing on failure.
     *
     * @param span the span
     */
    static void finish(final Span span) {
        try {
            span.end();
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to finish span: {}", e.getMessage());
        }
    }
}
