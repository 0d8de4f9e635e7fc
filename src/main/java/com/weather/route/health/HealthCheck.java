package com.weather.route.health;

/**
 * A single component check.
 */
public interface HealthCheck {

    String getName();

    /**
     * Checks the component. Implementations report failures as a status rather than throwing.
     */
    HealthStatus check();
}
