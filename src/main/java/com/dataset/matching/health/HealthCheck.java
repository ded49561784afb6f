package com.dataset.matching.health;

/**
 * A check of one matching-engine dependency.
 */
public interface HealthCheck {

    String getName();

    /**
     * Checks the dependency. Implementations report failures as {@link HealthStatus.State#DOWN}
     * rather than throwing.
     */
    HealthStatus check();
}
