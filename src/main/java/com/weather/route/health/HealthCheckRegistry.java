package com.weather.route.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered checks and folds them into one status: the worst component status wins,
 * and each component's result is kept as a detail under its name.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public HealthCheckRegistry register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
        return this;
    }

    public HealthStatus checkAll() {
        HealthStatus aggregate = HealthStatus.up();
        Map<String, Object> components = new LinkedHashMap<>();

        for (HealthCheck check : checks) {
            HealthStatus result;
            try {
                result = check.check();
            } catch (RuntimeException e) {
                log.warn("Health check '{}' threw: {}", check.getName(), e.getMessage());
                result = HealthStatus.down(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            components.put(check.getName(), result);
            if (result.isWorseThan(aggregate)) {
                aggregate = new HealthStatus(result.status(), check.getName() + ": " + result.message(), Map.of());
            }
        }
        return new HealthStatus(aggregate.status(), aggregate.message(), components);
    }

    public int size() {
        return checks.size();
    }
}
