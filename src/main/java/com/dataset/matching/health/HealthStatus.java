package com.dataset.matching.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a health check, or the aggregate of several.
 *
 * @param state   UP, DEGRADED or DOWN, ordered from best to worst
 * @param message short human-readable explanation
 * @param details check-specific values such as latency or entry counts
 */
public record HealthStatus(State state, String message, Map<String, Object> details) {

    public enum State { UP, DEGRADED, DOWN }

    public HealthStatus {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(State.UP, message, Map.of());
    }

    public static HealthStatus degraded(String message) {
        return new HealthStatus(State.DEGRADED, message, Map.of());
    }

    public static HealthStatus down(String message) {
        return new HealthStatus(State.DOWN, message, Map.of());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new HealthStatus(state, message, merged);
    }

    public boolean isWorseThan(HealthStatus other) {
        return state.ordinal() > other.state.ordinal();
    }

    public boolean isUp() {
        return state == State.UP;
    }
}
