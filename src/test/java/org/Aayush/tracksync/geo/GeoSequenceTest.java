package org.Aayush.tracksync.geo;

import org.Aayush.tracksync.testutil.TrackFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Geo Sequence Tests")
class GeoSequenceTest {

    @Test
    @DisplayName("Points are flattened across segments in order")
    void testSegmentsAndPoints() {
        GeoSequence sequence = TrackFixtures.sequence(3);
        sequence.addSegment(TrackFixtures.points(2, 10.0d, TrackFixtures.START, TrackFixtures.TIME_STEP));

        assertEquals(2, sequence.segments().size());
        assertEquals(5, sequence.pointCount());
        assertEquals(10.0d, sequence.points().get(3).latitude(), 0.0d);
        assertEquals(TrackFixtures.START, sequence.firstTime());
        assertEquals(TrackFixtures.START.plusSeconds(10), sequence.lastTime());
        assertThrows(UnsupportedOperationException.class, () -> sequence.points().clear());
    }

    @Test
    @DisplayName("An empty sequence reports the fallback time")
    void testFallbackTime() {
        GeoSequence sequence = new GeoSequence();
        assertNull(sequence.firstTime());

        sequence.setFallbackTime(TrackFixtures.START);

        assertTrue(sequence.isEmpty());
        assertEquals(TrackFixtures.START, sequence.firstTime());
        assertEquals(TrackFixtures.START, sequence.lastTime());
    }

    @Test
    @DisplayName("Distance and speed follow the point spacing")
    void testDistanceAndSpeed() {
        GeoSequence sequence = TrackFixtures.sequence(11);

        // ten steps of about 67.7 m
        assertEquals(0.677d, sequence.distanceKm(), 0.002d);
        assertEquals(24.4d, sequence.speedKmh(), 0.2d);
        assertEquals(sequence.speedKmh(), sequence.movingSpeedKmh(), 0.1d);
        assertEquals(0.0d, new GeoSequence().speedKmh(), 0.0d);
    }

    @Test
    @DisplayName("Intervals below walking crawl do not count as moving")
    void testMovingSpeedSkipsStops() {
        GeoSequence sequence = TrackFixtures.sequence(5);
        GeoPoint last = sequence.lastPoint();
        sequence.addPoints(List.of(last.withTime(last.time().plus(Duration.ofHours(1)))));

        assertTrue(sequence.movingSpeedKmh() > 20.0d);
        assertTrue(sequence.speedKmh() < 1.0d);
    }

    @Test
    @DisplayName("A copy shares no mutable state")
    void testCopy() {
        GeoSequence original = TrackFixtures.sequence(3);
        GeoSequence copy = original.copy();

        copy.addPoints(TrackFixtures.points(1));
        copy.addWaypoint(Waypoint.of(GeoPoint.of(1.0d, 1.0d), "x"));

        assertEquals(3, original.pointCount());
        assertTrue(original.waypoints().isEmpty());
    }

    @Test
    @DisplayName("Adjusting time moves points and waypoints")
    void testAdjustTime() {
        GeoSequence sequence = TrackFixtures.sequence(3);
        sequence.addWaypoint(Waypoint.of(GeoPoint.of(52.5d, 13.4d, TrackFixtures.START), "start"));

        sequence.adjustTime(Duration.ofMinutes(5));

        assertEquals(TrackFixtures.START.plus(Duration.ofMinutes(5)), sequence.firstTime());
        assertEquals(TrackFixtures.START.plus(Duration.ofMinutes(5)), sequence.waypoints().get(0).getPosition().time());
    }

    @Test
    @DisplayName("Time offset requires start and end to be shifted alike")
    void testTimeOffset() {
        List<GeoPoint> points = TrackFixtures.points(10);
        GeoSequence original = GeoSequence.of(points);
        GeoSequence shifted = GeoSequence.of(TrackFixtures.shifted(points, Duration.ofHours(2)));

        assertEquals(Duration.ofHours(2), original.timeOffset(shifted));
        assertNull(original.timeOffset(original.copy()));

        GeoSequence stretched = GeoSequence.of(TrackFixtures.points(
                10, TrackFixtures.START_LATITUDE, TrackFixtures.START.plusSeconds(60), Duration.ofSeconds(20)));
        assertNull(original.timeOffset(stretched));
    }

    @Test
    @DisplayName("A contiguous run is found by position")
    void testIndexOf() {
        List<GeoPoint> points = northbound(30);
        GeoSequence sequence = GeoSequence.of(points);

        assertEquals(12, sequence.indexOf(GeoSequence.of(points.subList(12, 20)), 4));
        assertEquals(-1, GeoSequence.of(points.subList(12, 20)).indexOf(sequence, 4));
        assertEquals(-1, sequence.indexOf(GeoSequence.of(northbound(3, 10.0d)), 4));
    }

    @Test
    @DisplayName("Equal points ignore time and elevation")
    void testPointsEqual() {
        List<GeoPoint> points = northbound(10);
        GeoSequence sequence = GeoSequence.of(points);
        GeoSequence shifted = GeoSequence.of(TrackFixtures.shifted(points, Duration.ofHours(1)));

        assertTrue(sequence.pointsEqual(shifted, 4));
        assertFalse(sequence.pointsEqual(GeoSequence.of(points.subList(0, 9)), 4));
        assertEquals(10, sequence.firstDifferentPoint(shifted));
        assertEquals(0, sequence.firstDifferentPoint(GeoSequence.of(northbound(10, 10.0d))));
    }

    @Test
    @DisplayName("Long pauses and backwards steps start new segments")
    void testSplitAtJumps() {
        List<GeoPoint> points = new java.util.ArrayList<>(TrackFixtures.points(3));
        GeoPoint last = points.get(2);
        points.add(GeoPoint.of(last.latitude(), last.longitude(), last.time().minusSeconds(5)));
        GeoSequence sequence = GeoSequence.of(points);

        assertTrue(sequence.splitAtJumps(Duration.ofMinutes(10), 5_000.0d));

        assertEquals(2, sequence.segments().size());
        assertEquals(4, sequence.pointCount());
        assertFalse(TrackFixtures.sequence(5).splitAtJumps(Duration.ofMinutes(10), 5_000.0d));
    }

    @Test
    @DisplayName("The points hash is stable for equal content and changes with positions")
    void testPointsHash() {
        assertEquals(TrackFixtures.sequence(20).pointsHash(), TrackFixtures.sequence(20).pointsHash(), 0.0d);
        GeoSequence other = GeoSequence.of(TrackFixtures.points(20, 40.0d, TrackFixtures.START, TrackFixtures.TIME_STEP));
        assertTrue(TrackFixtures.sequence(20).pointsHash() != other.pointsHash());
    }

    @Test
    @DisplayName("Position keys collapse repeated positions")
    void testPositionKeys() {
        GeoSequence sequence = TrackFixtures.sequence(4);
        sequence.addPoints(TrackFixtures.points(2));

        assertEquals(4, sequence.positionKeys().size());
    }

    private static List<GeoPoint> northbound(int count) {
        return northbound(count, TrackFixtures.START_LATITUDE);
    }

    // 0.01 degrees apart, so neighbours differ beyond four relative digits
    private static List<GeoPoint> northbound(int count, double latitude) {
        List<GeoPoint> result = new java.util.ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(GeoPoint.of(latitude + i * 0.01d, TrackFixtures.START_LONGITUDE,
                    TrackFixtures.START.plus(TrackFixtures.TIME_STEP.multipliedBy(i))));
        }
        return result;
    }
}
