package com.dataset.matching.health;

import com.dataset.matching.core.model.Dataset;
import com.dataset.matching.store.ReferenceStore;

import java.util.List;

/**
 * Lists the active datasets. No active dataset means every query returns nothing,
 * which is reported as DEGRADED.
 */
public class ReferenceStoreHealthCheck implements HealthCheck {

    private final ReferenceStore store;

    public ReferenceStoreHealthCheck(ReferenceStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return "reference-store";
    }

    @Override
    public HealthStatus check() {
        long start = System.nanoTime();
        List<Dataset> active;
        try {
            active = store.findActiveDatasets();
        } catch (RuntimeException e) {
            return HealthStatus.down("reference store unreachable: " + e.getMessage())
                    .withDetail("store", store.getName());
        }
        long latencyMs = (System.nanoTime() - start) / 1_000_000;
        HealthStatus status = active.isEmpty()
                ? HealthStatus.degraded("no active reference dataset")
                : HealthStatus.up(active.size() + " active datasets");
        return status
                .withDetail("store", store.getName())
                .withDetail("activeDatasets", active.size())
                .withDetail("latencyMs", latencyMs);
    }
}
