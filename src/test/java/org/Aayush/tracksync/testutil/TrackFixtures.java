package org.Aayush.tracksync.testutil;

import org.Aayush.tracksync.geo.GeoPoint;
import org.Aayush.tracksync.geo.GeoSequence;
import org.Aayush.tracksync.record.Record;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Synthetic tracks for tests.
 */
public final class TrackFixtures {
    public static final Instant START = Instant.parse("2024-01-01T07:56:00Z");
    public static final double START_LATITUDE = 52.5d;
    public static final double START_LONGITUDE = 13.4d;
    /** About 68 m east per step at the start latitude. */
    public static final double LONGITUDE_STEP = 0.001d;
    public static final Duration TIME_STEP = Duration.ofSeconds(10);

    private TrackFixtures() {
    }

    /**
     * Points heading east, one every {@link #TIME_STEP}, starting at {@link #START}.
     */
    public static List<GeoPoint> points(int count) {
        return points(count, START_LATITUDE, START, TIME_STEP);
    }

    public static List<GeoPoint> points(int count, double latitude, Instant start, Duration step) {
        List<GeoPoint> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(GeoPoint.of(
                    latitude,
                    START_LONGITUDE + i * LONGITUDE_STEP,
                    30.0d + (i % 5),
                    start.plus(step.multipliedBy(i))));
        }
        return result;
    }

    public static GeoSequence sequence(int count) {
        return GeoSequence.of(points(count));
    }

    public static Record record(int count) {
        return new Record(sequence(count));
    }

    public static Record record(List<GeoPoint> points) {
        return new Record(GeoSequence.of(points));
    }

    public static List<GeoPoint> shifted(List<GeoPoint> points, Duration delta) {
        List<GeoPoint> result = new ArrayList<>(points.size());
        for (GeoPoint point : points) {
            result.add(point.shifted(delta));
        }
        return result;
    }

    /**
     * Copy of {@code points} where {@code count} points from {@code from} are moved north.
     */
    public static List<GeoPoint> displaced(List<GeoPoint> points, int from, int count) {
        List<GeoPoint> result = new ArrayList<>(points);
        for (int i = from; i < from + count; i++) {
            GeoPoint point = result.get(i);
            result.set(i, GeoPoint.of(point.latitude() + 0.01d, point.longitude(), point.elevation(), point.time()));
        }
        return result;
    }
}
