package com.dataset.matching.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs registered checks and folds them into one status; the worst state wins.
 * A check that throws counts as DOWN.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final Map<String, HealthCheck> checks = new LinkedHashMap<>();

    public synchronized void register(HealthCheck check) {
        checks.put(check.getName(), check);
    }

    public synchronized HealthStatus checkAll() {
        HealthStatus aggregate = HealthStatus.up("all checks passed");
        Map<String, HealthStatus> results = new LinkedHashMap<>();
        for (HealthCheck check : checks.values()) {
            HealthStatus result = run(check);
            results.put(check.getName(), result);
            if (result.isWorseThan(aggregate)) {
                aggregate = new HealthStatus(result.state(), check.getName() + ": " + result.message(), Map.of());
            }
        }
        for (Map.Entry<String, HealthStatus> entry : results.entrySet()) {
            HealthStatus result = entry.getValue();
            aggregate = aggregate.withDetail(entry.getKey(), Map.of(
                    "state", result.state().name(),
                    "message", String.valueOf(result.message()),
                    "details", result.details()));
        }
        return aggregate;
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("health.check.failed name={} reason={}", check.getName(), e.getMessage());
            return HealthStatus.down(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public synchronized int size() {
        return checks.size();
    }
}
