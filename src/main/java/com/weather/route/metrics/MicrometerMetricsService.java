package com.weather.route.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code weather.route.cache.lookups} - Counter (tags: layer, outcome)</li>
 *   <li>{@code weather.route.cache.layer.failures} - Counter (tag: layer)</li>
 *   <li>{@code weather.route.singleflight} - Counter (tag: role)</li>
 *   <li>{@code weather.route.provider.calls} - Timer (tags: provider, outcome)</li>
 *   <li>{@code weather.route.path.search} - Timer (tag: found)</li>
 *   <li>{@code weather.route.path.settled} - DistributionSummary</li>
 *   <li>{@code weather.route.weather.stale} - Counter</li>
 *   <li>{@code weather.route.graph.injected.nodes} / {@code .edges} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary settledNodesSummary;
    private final Counter staleServeCounter;
    private final Counter injectedNodesCounter;
    private final Counter injectedEdgesCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.settledNodesSummary = DistributionSummary.builder("weather.route.path.settled")
                .description("Nodes settled per shortest-path search")
                .register(registry);
        this.staleServeCounter = Counter.builder("weather.route.weather.stale")
                .description("Weather lookups answered from the stale grace window")
                .register(registry);
        this.injectedNodesCounter = Counter.builder("weather.route.graph.injected.nodes")
                .description("Nodes created or reused while injecting provider geometry")
                .register(registry);
        this.injectedEdgesCounter = Counter.builder("weather.route.graph.injected.edges")
                .description("Edges upserted while injecting provider geometry")
                .register(registry);
    }

    @Override
    public void recordCacheLookup(String layer, boolean hit) {
        String outcome = hit ? "hit" : "miss";
        counter("lookup:" + layer + ":" + outcome, () -> Counter.builder("weather.route.cache.lookups")
                .description("Cache lookups per layer")
                .tag("layer", layer)
                .tag("outcome", outcome)
                .register(registry)).increment();
    }

    @Override
    public void recordCacheLayerFailure(String layer) {
        counter("failure:" + layer, () -> Counter.builder("weather.route.cache.layer.failures")
                .description("Cache layer operations that failed and were absorbed")
                .tag("layer", layer)
                .register(registry)).increment();
    }

    @Override
    public void recordSingleflight(String role) {
        counter("singleflight:" + role, () -> Counter.builder("weather.route.singleflight")
                .description("Single-flight gate outcomes")
                .tag("role", role)
                .register(registry)).increment();
    }

    @Override
    public void recordProviderCall(String provider, String outcome, Duration duration) {
        String key = provider + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("weather.route.provider.calls")
                        .description("Calls to external providers")
                        .tag("provider", provider)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordPathSearch(Duration duration, int settledNodes, boolean found) {
        String foundTag = Boolean.toString(found);
        Timer timer = timerCache.computeIfAbsent("path:" + foundTag, k ->
                Timer.builder("weather.route.path.search")
                        .description("Shortest-path search duration")
                        .tag("found", foundTag)
                        .register(registry));
        timer.record(duration);
        settledNodesSummary.record(settledNodes);
    }

    @Override
    public void recordStaleServe() {
        staleServeCounter.increment();
    }

    @Override
    public void recordGraphInjection(int nodes, int edges) {
        injectedNodesCounter.increment(nodes);
        injectedEdgesCounter.increment(edges);
    }

    private Counter counter(String key, Supplier<Counter> factory) {
        return counterCache.computeIfAbsent(key, k -> factory.get());
    }
}
