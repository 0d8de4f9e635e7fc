package com.weather.route.api;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Engine configuration. Immutable; build with {@link #builder()} or load from properties with
 * {@link #fromProperties(Properties)}.
 */
public class EngineConfig {

    /** Geohash length of a weather cell, about 4.9 km x 4.9 km. */
    public static final int DEFAULT_CELL_PRECISION = 5;
    /** Geohash length of the nearest-node bucket grid, about 153 m x 153 m. */
    public static final int DEFAULT_NODE_INDEX_PRECISION = 7;
    public static final Duration DEFAULT_STALE_GRACE_WINDOW = Duration.ofHours(1);
    public static final Duration DEFAULT_LEADER_LOCK_TTL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_FOLLOWER_WAIT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_FOLLOWER_POLL_INTERVAL = Duration.ofMillis(200);
    public static final double DEFAULT_NODE_SNAP_TOLERANCE_METERS = 50.0;
    public static final double DEFAULT_PLACE_SEARCH_RADIUS_METERS = 5_000.0;
    public static final Duration DEFAULT_ROUTE_FAST_TTL = Duration.ofHours(24);
    public static final Duration DEFAULT_PROVIDER_TIMEOUT = Duration.ofSeconds(20);
    public static final double DEFAULT_INJECTION_SAMPLE_KM = 1.0;
    public static final double DEFAULT_WEATHER_SAMPLE_KM = 10.0;
    public static final int DEFAULT_MAX_PARALLEL_WEATHER_FETCHES = 8;
    public static final double DEFAULT_SPEED_KMH = 50.0;
    public static final long DEFAULT_FAST_LAYER_MAX_SIZE = 100_000;
    public static final ZoneId DEFAULT_ZONE = ZoneOffset.UTC;

    static final String PREFIX = "weather-route.";

    private final int cellPrecision;
    private final int nodeIndexPrecision;
    private final Duration staleGraceWindow;
    private final Duration leaderLockTtl;
    private final Duration followerWaitTimeout;
    private final Duration followerPollInterval;
    private final double nodeSnapToleranceMeters;
    private final double placeSearchRadiusMeters;
    private final Duration routeFastTtl;
    private final Duration providerTimeout;
    private final double injectionSampleKm;
    private final double weatherSampleKm;
    private final int maxParallelWeatherFetches;
    private final double defaultSpeedKmh;
    private final long fastLayerMaxSize;
    private final ZoneId defaultZone;

    private EngineConfig(Builder builder) {
        this.cellPrecision = builder.cellPrecision;
        this.nodeIndexPrecision = builder.nodeIndexPrecision;
        this.staleGraceWindow = builder.staleGraceWindow;
        this.leaderLockTtl = builder.leaderLockTtl;
        this.followerWaitTimeout = builder.followerWaitTimeout;
        this.followerPollInterval = builder.followerPollInterval;
        this.nodeSnapToleranceMeters = builder.nodeSnapToleranceMeters;
        this.placeSearchRadiusMeters = builder.placeSearchRadiusMeters;
        this.routeFastTtl = builder.routeFastTtl;
        this.providerTimeout = builder.providerTimeout;
        this.injectionSampleKm = builder.injectionSampleKm;
        this.weatherSampleKm = builder.weatherSampleKm;
        this.maxParallelWeatherFetches = builder.maxParallelWeatherFetches;
        this.defaultSpeedKmh = builder.defaultSpeedKmh;
        this.fastLayerMaxSize = builder.fastLayerMaxSize;
        this.defaultZone = builder.defaultZone;
    }

    public int getCellPrecision() {
        return cellPrecision;
    }

    public int getNodeIndexPrecision() {
        return nodeIndexPrecision;
    }

    /**
     * How long past expiry a durable weather entry may still be served, flagged stale,
     * when the provider fails.
     */
    public Duration getStaleGraceWindow() {
        return staleGraceWindow;
    }

    public Duration getLeaderLockTtl() {
        return leaderLockTtl;
    }

    public Duration getFollowerWaitTimeout() {
        return followerWaitTimeout;
    }

    public Duration getFollowerPollInterval() {
        return followerPollInterval;
    }

    public double getNodeSnapToleranceMeters() {
        return nodeSnapToleranceMeters;
    }

    /**
     * Radius around a place in which graph nodes count as candidate route endpoints.
     */
    public double getPlaceSearchRadiusMeters() {
        return placeSearchRadiusMeters;
    }

    public Duration getRouteFastTtl() {
        return routeFastTtl;
    }

    public Duration getProviderTimeout() {
        return providerTimeout;
    }

    public double getInjectionSampleKm() {
        return injectionSampleKm;
    }

    public double getWeatherSampleKm() {
        return weatherSampleKm;
    }

    public int getMaxParallelWeatherFetches() {
        return maxParallelWeatherFetches;
    }

    public double getDefaultSpeedKmh() {
        return defaultSpeedKmh;
    }

    public long getFastLayerMaxSize() {
        return fastLayerMaxSize;
    }

    public ZoneId getDefaultZone() {
        return defaultZone;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code weather-route.*} keys. Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException naming the key when a value cannot be parsed or is out of range
     */
    public static EngineConfig fromProperties(Properties properties) {
        Builder builder = builder();
        PropertyReader reader = new PropertyReader(properties);
        reader.integer("cache.cell-precision", builder::cellPrecision);
        reader.longValue("cache.fast-max-size", builder::fastLayerMaxSize);
        reader.duration("cache.stale-grace-window", builder::staleGraceWindow);
        reader.duration("lock.leader-ttl", builder::leaderLockTtl);
        reader.duration("lock.follower-wait-timeout", builder::followerWaitTimeout);
        reader.duration("lock.follower-poll-interval", builder::followerPollInterval);
        reader.integer("graph.node-index-precision", builder::nodeIndexPrecision);
        reader.decimal("graph.snap-tolerance-meters", builder::nodeSnapToleranceMeters);
        reader.decimal("graph.injection-sample-km", builder::injectionSampleKm);
        reader.decimal("graph.default-speed-kmh", builder::defaultSpeedKmh);
        reader.decimal("route.place-search-radius-meters", builder::placeSearchRadiusMeters);
        reader.duration("route.fast-ttl", builder::routeFastTtl);
        reader.duration("provider.timeout", builder::providerTimeout);
        reader.decimal("weather.sample-km", builder::weatherSampleKm);
        reader.integer("weather.max-parallel-fetches", builder::maxParallelWeatherFetches);
        reader.zone("weather.default-zone", builder::defaultZone);
        return builder.build();
    }

    public static class Builder {
        private int cellPrecision = DEFAULT_CELL_PRECISION;
        private int nodeIndexPrecision = DEFAULT_NODE_INDEX_PRECISION;
        private Duration staleGraceWindow = DEFAULT_STALE_GRACE_WINDOW;
        private Duration leaderLockTtl = DEFAULT_LEADER_LOCK_TTL;
        private Duration followerWaitTimeout = DEFAULT_FOLLOWER_WAIT_TIMEOUT;
        private Duration followerPollInterval = DEFAULT_FOLLOWER_POLL_INTERVAL;
        private double nodeSnapToleranceMeters = DEFAULT_NODE_SNAP_TOLERANCE_METERS;
        private double placeSearchRadiusMeters = DEFAULT_PLACE_SEARCH_RADIUS_METERS;
        private Duration routeFastTtl = DEFAULT_ROUTE_FAST_TTL;
        private Duration providerTimeout = DEFAULT_PROVIDER_TIMEOUT;
        private double injectionSampleKm = DEFAULT_INJECTION_SAMPLE_KM;
        private double weatherSampleKm = DEFAULT_WEATHER_SAMPLE_KM;
        private int maxParallelWeatherFetches = DEFAULT_MAX_PARALLEL_WEATHER_FETCHES;
        private double defaultSpeedKmh = DEFAULT_SPEED_KMH;
        private long fastLayerMaxSize = DEFAULT_FAST_LAYER_MAX_SIZE;
        private ZoneId defaultZone = DEFAULT_ZONE;

        public Builder cellPrecision(int cellPrecision) {
            validatePrecision(cellPrecision, "cellPrecision");
            this.cellPrecision = cellPrecision;
            return this;
        }

        public Builder nodeIndexPrecision(int nodeIndexPrecision) {
            validatePrecision(nodeIndexPrecision, "nodeIndexPrecision");
            this.nodeIndexPrecision = nodeIndexPrecision;
            return this;
        }

        public Builder staleGraceWindow(Duration staleGraceWindow) {
            if (staleGraceWindow == null || staleGraceWindow.isNegative()) {
                throw new IllegalArgumentException("staleGraceWindow must be >= 0");
            }
            this.staleGraceWindow = staleGraceWindow;
            return this;
        }

        public Builder leaderLockTtl(Duration leaderLockTtl) {
            this.leaderLockTtl = requirePositive(leaderLockTtl, "leaderLockTtl");
            return this;
        }

        public Builder followerWaitTimeout(Duration followerWaitTimeout) {
            this.followerWaitTimeout = requirePositive(followerWaitTimeout, "followerWaitTimeout");
            return this;
        }

        public Builder followerPollInterval(Duration followerPollInterval) {
            this.followerPollInterval = requirePositive(followerPollInterval, "followerPollInterval");
            return this;
        }

        public Builder nodeSnapToleranceMeters(double nodeSnapToleranceMeters) {
            if (nodeSnapToleranceMeters < 0 || !Double.isFinite(nodeSnapToleranceMeters)) {
                throw new IllegalArgumentException("nodeSnapToleranceMeters must be >= 0");
            }
            this.nodeSnapToleranceMeters = nodeSnapToleranceMeters;
            return this;
        }

        public Builder placeSearchRadiusMeters(double placeSearchRadiusMeters) {
            this.placeSearchRadiusMeters = requirePositive(placeSearchRadiusMeters, "placeSearchRadiusMeters");
            return this;
        }

        public Builder routeFastTtl(Duration routeFastTtl) {
            this.routeFastTtl = requirePositive(routeFastTtl, "routeFastTtl");
            return this;
        }

        public Builder providerTimeout(Duration providerTimeout) {
            this.providerTimeout = requirePositive(providerTimeout, "providerTimeout");
            return this;
        }

        public Builder injectionSampleKm(double injectionSampleKm) {
            this.injectionSampleKm = requirePositive(injectionSampleKm, "injectionSampleKm");
            return this;
        }

        public Builder weatherSampleKm(double weatherSampleKm) {
            this.weatherSampleKm = requirePositive(weatherSampleKm, "weatherSampleKm");
            return this;
        }

        public Builder maxParallelWeatherFetches(int maxParallelWeatherFetches) {
            if (maxParallelWeatherFetches <= 0) {
                throw new IllegalArgumentException("maxParallelWeatherFetches must be positive");
            }
            this.maxParallelWeatherFetches = maxParallelWeatherFetches;
            return this;
        }

        public Builder defaultSpeedKmh(double defaultSpeedKmh) {
            this.defaultSpeedKmh = requirePositive(defaultSpeedKmh, "defaultSpeedKmh");
            return this;
        }

        public Builder fastLayerMaxSize(long fastLayerMaxSize) {
            if (fastLayerMaxSize <= 0) {
                throw new IllegalArgumentException("fastLayerMaxSize must be positive");
            }
            this.fastLayerMaxSize = fastLayerMaxSize;
            return this;
        }

        public Builder defaultZone(ZoneId defaultZone) {
            if (defaultZone == null) {
                throw new IllegalArgumentException("defaultZone is required");
            }
            this.defaultZone = defaultZone;
            return this;
        }

        public EngineConfig build() {
            if (nodeIndexPrecision < cellPrecision) {
                throw new IllegalArgumentException("nodeIndexPrecision must be >= cellPrecision");
            }
            if (followerPollInterval.compareTo(followerWaitTimeout) > 0) {
                throw new IllegalArgumentException("followerPollInterval must not exceed followerWaitTimeout");
            }
            return new EngineConfig(this);
        }

        private static void validatePrecision(int precision, String name) {
            if (precision < 1 || precision > 12) {
                throw new IllegalArgumentException(name + " must be between 1 and 12");
            }
        }

        private static Duration requirePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
            return value;
        }

        private static double requirePositive(double value, String name) {
            if (!(value > 0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
            return value;
        }
    }

    /**
     * Parses one property at a time and names the offending key on failure.
     */
    private static final class PropertyReader {
        private final Properties properties;

        PropertyReader(Properties properties) {
            this.properties = properties != null ? properties : new Properties();
        }

        void integer(String key, IntConsumer target) {
            String raw = raw(key);
            if (raw != null) {
                try {
                    target.accept(Integer.parseInt(raw));
                } catch (IllegalArgumentException e) {
                    throw invalid(key, raw, e);
                }
            }
        }

        void longValue(String key, LongConsumer target) {
            String raw = raw(key);
            if (raw != null) {
                try {
                    target.accept(Long.parseLong(raw.replace("_", "")));
                } catch (IllegalArgumentException e) {
                    throw invalid(key, raw, e);
                }
            }
        }

        void decimal(String key, DoubleConsumer target) {
            String raw = raw(key);
            if (raw != null) {
                try {
                    target.accept(Double.parseDouble(raw));
                } catch (IllegalArgumentException e) {
                    throw invalid(key, raw, e);
                }
            }
        }

        void duration(String key, Consumer<Duration> target) {
            String raw = raw(key);
            if (raw != null) {
                try {
                    target.accept(parseDuration(raw));
                } catch (IllegalArgumentException | DateTimeException e) {
                    throw invalid(key, raw, e);
                }
            }
        }

        void zone(String key, Consumer<ZoneId> target) {
            String raw = raw(key);
            if (raw != null) {
                try {
                    target.accept(ZoneId.of(raw));
                } catch (IllegalArgumentException | DateTimeException e) {
                    throw invalid(key, raw, e);
                }
            }
        }

        private String raw(String key) {
            String value = properties.getProperty(PREFIX + key);
            return value == null || value.isBlank() ? null : value.trim();
        }

        private static IllegalArgumentException invalid(String key, String raw, Exception cause) {
            return new IllegalArgumentException("Invalid value for " + PREFIX + key + ": '" + raw + "' ("
                    + cause.getMessage() + ")", cause);
        }
    }

    /**
     * Accepts ISO-8601 ({@code PT30S}) or a number with a unit suffix: {@code ms}, {@code s}, {@code m}, {@code h}, {@code d}.
     */
    static Duration parseDuration(String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("p")) {
            return Duration.parse(value.toUpperCase(Locale.ROOT));
        }
        if (value.endsWith("ms")) {
            return Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2).trim()));
        }
        long amount = Long.parseLong(value.substring(0, value.length() - 1).trim());
        switch (value.charAt(value.length() - 1)) {
            case 's':
                return Duration.ofSeconds(amount);
            case 'm':
                return Duration.ofMinutes(amount);
            case 'h':
                return Duration.ofHours(amount);
            case 'd':
                return Duration.ofDays(amount);
            default:
                throw new IllegalArgumentException("Unknown duration unit in '" + raw + "'");
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "cellPrecision=" + cellPrecision +
                ", nodeIndexPrecision=" + nodeIndexPrecision +
                ", staleGraceWindow=" + staleGraceWindow +
                ", leaderLockTtl=" + leaderLockTtl +
                ", followerWaitTimeout=" + followerWaitTimeout +
                ", followerPollInterval=" + followerPollInterval +
                ", nodeSnapToleranceMeters=" + nodeSnapToleranceMeters +
                ", placeSearchRadiusMeters=" + placeSearchRadiusMeters +
                ", routeFastTtl=" + routeFastTtl +
                ", providerTimeout=" + providerTimeout +
                ", injectionSampleKm=" + injectionSampleKm +
                ", weatherSampleKm=" + weatherSampleKm +
                ", maxParallelWeatherFetches=" + maxParallelWeatherFetches +
                ", defaultSpeedKmh=" + defaultSpeedKmh +
                ", fastLayerMaxSize=" + fastLayerMaxSize +
                ", defaultZone=" + defaultZone +
                '}';
    }
}
