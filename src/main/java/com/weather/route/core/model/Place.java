package com.weather.route.core.model;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Objects;

/**
 * Named real-world location. Identity is (name, type, region); road geometry hangs off
 * {@link Node}s that reference the place as an access point.
 */
public final class Place {
    private final long id;
    private final String name;
    private final PlaceType type;
    private final String region;
    private final Coordinate coordinate;
    private final ZoneId zoneId;

    private Place(Builder builder) {
        this.id = builder.id;
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.type = builder.type != null ? builder.type : PlaceType.LOCALITY;
        this.region = builder.region != null ? builder.region : "";
        this.coordinate = Objects.requireNonNull(builder.coordinate, "coordinate is required");
        this.zoneId = builder.zoneId != null ? builder.zoneId : ZoneOffset.UTC;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public PlaceType getType() {
        return type;
    }

    public String getRegion() {
        return region;
    }

    public Coordinate getCoordinate() {
        return coordinate;
    }

    /**
     * IANA zone of the place. Only used to compute local hour boundaries for cache expiry.
     */
    public ZoneId getZoneId() {
        return zoneId;
    }

    /**
     * Normalized (name, type, region) identity used for uniqueness.
     */
    public String identityKey() {
        return identityKey(name, type, region);
    }

    public static String identityKey(String name, PlaceType type, String region) {
        return normalize(name) + "|" + type.name() + "|" + normalize(region);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public Builder toBuilder() {
        return builder()
                .id(id)
                .name(name)
                .type(type)
                .region(region)
                .coordinate(coordinate)
                .zoneId(zoneId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Place place = (Place) o;
        return id == place.id && identityKey().equals(place.identityKey());
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, identityKey());
    }

    @Override
    public String toString() {
        return "Place{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", type=" + type +
                ", region='" + region + '\'' +
                ", coordinate=" + coordinate +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long id;
        private String name;
        private PlaceType type;
        private String region;
        private Coordinate coordinate;
        private ZoneId zoneId;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(PlaceType type) {
            this.type = type;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder coordinate(Coordinate coordinate) {
            this.coordinate = coordinate;
            return this;
        }

        public Builder zoneId(ZoneId zoneId) {
            this.zoneId = zoneId;
            return this;
        }

        public Place build() {
            return new Place(this);
        }
    }
}
