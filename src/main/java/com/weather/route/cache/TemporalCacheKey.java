package com.weather.route.cache;

import com.weather.route.core.model.Coordinate;
import com.weather.route.spatial.SpatialCellIndex;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Builds weather cache keys of the form {@code weather:{cell}:{hourSlot}:{generation}} and computes
 * their expiry.
 *
 * <p>The hour slot is the start of the local forecast hour, written in UTC as {@code yyyyMMddHHmm}
 * so half-hour offset zones still get one slot per local hour. Expiry is the top of the next local
 * hour after the forecast time; once that instant has passed, the key is absent.</p>
 */
public class TemporalCacheKey {

    public static final String PREFIX = "weather";
    public static final String UNKNOWN_GENERATION = "latest";

    private static final DateTimeFormatter HOUR_SLOT =
            DateTimeFormatter.ofPattern("yyyyMMddHHmm").withZone(ZoneOffset.UTC);

    private final SpatialCellIndex cellIndex;

    public TemporalCacheKey(SpatialCellIndex cellIndex) {
        this.cellIndex = Objects.requireNonNull(cellIndex, "cellIndex is required");
    }

    public String cellOf(Coordinate coordinate) {
        return cellIndex.encode(coordinate);
    }

    /**
     * Key for the cell containing {@code coordinate}.
     */
    public String build(Coordinate coordinate, ZonedDateTime forecastTime, String modelGeneration) {
        return build(cellOf(coordinate), forecastTime, modelGeneration);
    }

    /**
     * Key for a cell, forecast time (with its local zone) and model generation.
     */
    public String build(String cellId, ZonedDateTime forecastTime, String modelGeneration) {
        if (cellId == null || cellId.isBlank()) {
            throw new IllegalArgumentException("cellId must not be blank");
        }
        Objects.requireNonNull(forecastTime, "forecastTime is required");
        return cellPrefix(cellId) + hourSlot(forecastTime) + ":" + normalizeGeneration(modelGeneration);
    }

    /**
     * Prefix shared by every key of a cell, for bulk invalidation.
     */
    public static String cellPrefix(String cellId) {
        return PREFIX + ":" + cellId + ":";
    }

    /**
     * Prefix shared by every generation of one cell and hour.
     */
    public static String hourPrefix(String cellId, ZonedDateTime forecastTime) {
        return cellPrefix(cellId) + hourSlot(forecastTime) + ":";
    }

    static String hourSlot(ZonedDateTime forecastTime) {
        return HOUR_SLOT.format(forecastTime.truncatedTo(ChronoUnit.HOURS).toInstant());
    }

    /**
     * Reduces a provider's model run label to {@code [A-Za-z0-9]}; blank becomes {@value #UNKNOWN_GENERATION}.
     */
    public static String normalizeGeneration(String modelGeneration) {
        if (modelGeneration == null) {
            return UNKNOWN_GENERATION;
        }
        String clean = modelGeneration.replaceAll("[^A-Za-z0-9]", "");
        return clean.isEmpty() ? UNKNOWN_GENERATION : clean;
    }

    /**
     * Top of the next local hour after {@code forecastTime}.
     */
    public static Instant expiresAt(Instant forecastTime, ZoneId zone) {
        ZonedDateTime local = forecastTime.atZone(zone);
        return local.truncatedTo(ChronoUnit.HOURS).plusHours(1).toInstant();
    }

    /**
     * Time left until {@link #expiresAt(Instant, ZoneId)}, or {@link Duration#ZERO} when the forecast
     * hour is already over.
     */
    public static Duration ttl(Instant forecastTime, ZoneId zone, Instant now) {
        Duration remaining = Duration.between(now, expiresAt(forecastTime, zone));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Whether the forecast hour has ended; such keys are treated as absent.
     */
    public static boolean isPastHour(Instant forecastTime, ZoneId zone, Instant now) {
        return !now.isBefore(expiresAt(forecastTime, zone));
    }
}
