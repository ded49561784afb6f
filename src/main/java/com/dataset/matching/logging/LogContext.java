package com.dataset.matching.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Scoped MDC entries, removed again on {@link #close()}:
 * <pre>
 * try (LogContext ctx = LogContext.forQuery(correlationId)) {
 *     log.info("match.completed matches={}", count);
 * }
 * </pre>
 * Closing restores whatever value a key held before this context set it.
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();
    private final List<String> previousValues = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forQuery(String correlationId) {
        return new LogContext()
                .with("correlationId", correlationId)
                .with("operation", "match");
    }

    public static LogContext forBatch(String batchId) {
        return new LogContext()
                .with("batchId", batchId)
                .with("operation", "batch");
    }

    public static LogContext forAffiliated(String correlationId, String companyName) {
        return new LogContext()
                .with("correlationId", correlationId)
                .with("affiliatedCompany", companyName)
                .with("operation", "affiliated");
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        keys.add(key);
        previousValues.add(MDC.get(key));
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        for (int i = keys.size() - 1; i >= 0; i--) {
            String previous = previousValues.get(i);
            if (previous != null) {
                MDC.put(keys.get(i), previous);
            } else {
                MDC.remove(keys.get(i));
            }
        }
        keys.clear();
        previousValues.clear();
    }
}
