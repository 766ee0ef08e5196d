package com.age.mcp.health;

/**
 * A single health probe (database, connection pools, ...).
 */
public interface HealthCheck {

    String getName();

    /**
     * Runs the probe. Implementations report failures as {@code DOWN} instead of throwing.
     */
    HealthStatus check();
}
