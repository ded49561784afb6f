package com.dataset.matching.tracing;

import java.util.Map;

/**
 * Starts trace spans around matching operations. {@link NoOpTracingService} is the default.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
