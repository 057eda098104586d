package org.Aayush.tracksync.geo;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable timestamped geographic point.
 *
 * <p>Latitude and longitude are rounded to {@value #COORDINATE_DIGITS} decimal digits on
 * construction because some collections truncate further digits.</p>
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public final class GeoPoint {
    public static final int COORDINATE_DIGITS = 6;

    private final double latitude;
    private final double longitude;
    /** Elevation in meters, {@code null} when unknown. */
    private final Double elevation;
    /** Point time, {@code null} when unknown. */
    private final Instant time;

    private GeoPoint(double latitude, double longitude, Double elevation, Instant time) {
        if (!Double.isFinite(latitude) || latitude < -90.0d || latitude > 90.0d) {
            throw new IllegalArgumentException("latitude out of range: " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180.0d || longitude > 180.0d) {
            throw new IllegalArgumentException("longitude out of range: " + longitude);
        }
        this.latitude = GeoDistance.round(latitude, COORDINATE_DIGITS);
        this.longitude = GeoDistance.round(longitude, COORDINATE_DIGITS);
        this.elevation = elevation;
        this.time = time;
    }

    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude, null, null);
    }

    public static GeoPoint of(double latitude, double longitude, Instant time) {
        return new GeoPoint(latitude, longitude, null, time);
    }

    public static GeoPoint of(double latitude, double longitude, Double elevation, Instant time) {
        return new GeoPoint(latitude, longitude, elevation, time);
    }

    public GeoPoint withTime(Instant newTime) {
        return new GeoPoint(latitude, longitude, elevation, newTime);
    }

    /**
     * Returns a copy moved in time by {@code delta}; points without time stay untimed.
     */
    public GeoPoint shifted(Duration delta) {
        if (time == null) {
            return this;
        }
        return new GeoPoint(latitude, longitude, elevation, time.plus(delta));
    }

    /**
     * True if both points share latitude and longitude within a relative tolerance of
     * {@code 10^-digits}. Elevation and time are ignored.
     */
    public boolean samePosition(GeoPoint other, int digits) {
        double tolerance = 1.0d / Math.pow(10.0d, digits);
        return GeoDistance.isClose(longitude, other.longitude, tolerance)
                && GeoDistance.isClose(latitude, other.latitude, tolerance);
    }

    /**
     * Packs longitude and latitude in microdegrees into one {@code long} key.
     */
    public long positionKey() {
        long lonMicro = Math.round(longitude * 1_000_000d);
        long latMicro = Math.round(latitude * 1_000_000d);
        return (lonMicro << 32) | (latMicro & 0xFFFF_FFFFL);
    }
}
