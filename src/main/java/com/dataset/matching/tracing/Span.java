package com.dataset.matching.tracing;

/**
 * A unit of traced work, ended by {@link #close()}:
 * <pre>
 * try (Span span = tracing.startSpan("match.query")) {
 *     span.setAttribute("matches", 3);
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
