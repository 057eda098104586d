package org.Aayush.tracksync.geo;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered segments of timestamped points plus standalone waypoints.
 *
 * <p>Points are expected in ascending time order. This is assumed, never enforced by
 * sorting: callers must supply ordered points.</p>
 *
 * <p>This class is mutable and not thread-safe. Mutations go through the owning record
 * so they are tracked for write-back.</p>
 */
public final class GeoSequence {
    /** Below this speed a point-to-point interval counts as stopped. */
    private static final double STOPPED_SPEED_KMH = 1.0d;
    private static final double HASH_MODULUS = 1e20d;

    private final List<List<GeoPoint>> segments = new ArrayList<>();
    private final List<Waypoint> waypoints = new ArrayList<>();
    private Instant fallbackTime;

    /**
     * Creates an empty sequence.
     */
    public GeoSequence() {
    }

    /**
     * Creates a single-segment sequence.
     */
    public static GeoSequence of(List<GeoPoint> points) {
        GeoSequence result = new GeoSequence();
        result.addPoints(points);
        return result;
    }

    /**
     * Returns a read-only snapshot of all segments.
     */
    public List<List<GeoPoint>> segments() {
        List<List<GeoPoint>> result = new ArrayList<>(segments.size());
        for (List<GeoPoint> segment : segments) {
            result.add(Collections.unmodifiableList(new ArrayList<>(segment)));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns all points of all segments as one flat read-only list.
     */
    public List<GeoPoint> points() {
        List<GeoPoint> result = new ArrayList<>(pointCount());
        for (List<GeoPoint> segment : segments) {
            result.addAll(segment);
        }
        return Collections.unmodifiableList(result);
    }

    public List<Waypoint> waypoints() {
        return Collections.unmodifiableList(new ArrayList<>(waypoints));
    }

    public int pointCount() {
        int count = 0;
        for (List<GeoPoint> segment : segments) {
            count += segment.size();
        }
        return count;
    }

    public boolean isEmpty() {
        return pointCount() == 0;
    }

    /**
     * First point of the first non-empty segment, or {@code null}.
     */
    public GeoPoint firstPoint() {
        for (List<GeoPoint> segment : segments) {
            if (!segment.isEmpty()) {
                return segment.get(0);
            }
        }
        return null;
    }

    /**
     * Last point of the last non-empty segment, or {@code null}.
     */
    public GeoPoint lastPoint() {
        for (int i = segments.size() - 1; i >= 0; i--) {
            List<GeoPoint> segment = segments.get(i);
            if (!segment.isEmpty()) {
                return segment.get(segment.size() - 1);
            }
        }
        return null;
    }

    /**
     * Time of the first point, or the fallback time when there are no points.
     */
    public Instant firstTime() {
        GeoPoint first = firstPoint();
        return first == null ? fallbackTime : first.time();
    }

    /**
     * Time of the last point, or the fallback time when there are no points.
     */
    public Instant lastTime() {
        GeoPoint last = lastPoint();
        return last == null ? fallbackTime : last.time();
    }

    public Instant fallbackTime() {
        return fallbackTime;
    }

    public void setFallbackTime(Instant fallbackTime) {
        this.fallbackTime = fallbackTime;
    }

    /**
     * Appends points to the last segment, allocating one if needed.
     */
    public void addPoints(Collection<GeoPoint> points) {
        Objects.requireNonNull(points, "points");
        if (points.isEmpty()) {
            return;
        }
        if (segments.isEmpty()) {
            segments.add(new ArrayList<>());
        }
        List<GeoPoint> last = segments.get(segments.size() - 1);
        for (GeoPoint point : points) {
            last.add(Objects.requireNonNull(point, "point"));
        }
    }

    /**
     * Appends a new segment.
     */
    public void addSegment(Collection<GeoPoint> points) {
        Objects.requireNonNull(points, "points");
        List<GeoPoint> segment = new ArrayList<>(points.size());
        for (GeoPoint point : points) {
            segment.add(Objects.requireNonNull(point, "point"));
        }
        segments.add(segment);
    }

    public void addWaypoint(Waypoint waypoint) {
        waypoints.add(Objects.requireNonNull(waypoint, "waypoint"));
    }

    /**
     * Replaces the point at a flat index (counted across all segments).
     */
    public void setPoint(int flatIndex, GeoPoint point) {
        Objects.requireNonNull(point, "point");
        int remaining = flatIndex;
        for (List<GeoPoint> segment : segments) {
            if (remaining < segment.size()) {
                segment.set(remaining, point);
                return;
            }
            remaining -= segment.size();
        }
        throw new IndexOutOfBoundsException("point index out of bounds: " + flatIndex);
    }

    /**
     * Replaces this content with a deep copy of {@code other}.
     */
    public void replaceWith(GeoSequence other) {
        Objects.requireNonNull(other, "other");
        if (other == this) {
            return;
        }
        List<List<GeoPoint>> newSegments = new ArrayList<>(other.segments.size());
        for (List<GeoPoint> segment : other.segments) {
            newSegments.add(new ArrayList<>(segment));
        }
        List<Waypoint> newWaypoints = new ArrayList<>(other.waypoints);
        segments.clear();
        segments.addAll(newSegments);
        waypoints.clear();
        waypoints.addAll(newWaypoints);
        fallbackTime = other.fallbackTime;
    }

    /**
     * Replaces only the segments with a deep copy of the segments of {@code other}.
     */
    public void replaceSegmentsWith(GeoSequence other) {
        Objects.requireNonNull(other, "other");
        List<List<GeoPoint>> newSegments = new ArrayList<>(other.segments.size());
        for (List<GeoPoint> segment : other.segments) {
            newSegments.add(new ArrayList<>(segment));
        }
        segments.clear();
        segments.addAll(newSegments);
    }

    /**
     * Deep copy. Points and waypoints are immutable, so copying the lists suffices.
     */
    public GeoSequence copy() {
        GeoSequence result = new GeoSequence();
        result.replaceWith(this);
        return result;
    }

    /**
     * Moves every timed point and waypoint by {@code delta}.
     */
    public void adjustTime(Duration delta) {
        Objects.requireNonNull(delta, "delta");
        for (List<GeoPoint> segment : segments) {
            segment.replaceAll(point -> point.shifted(delta));
        }
        waypoints.replaceAll(waypoint -> waypoint.shifted(delta));
        if (fallbackTime != null) {
            fallbackTime = fallbackTime.plus(delta);
        }
    }

    /**
     * Sum of great-circle lengths of all segments in kilometers, rounded to meters.
     */
    public double distanceKm() {
        double meters = 0.0d;
        for (List<GeoPoint> segment : segments) {
            for (int i = 1; i < segment.size(); i++) {
                meters += GeoDistance.distanceMeters(segment.get(i - 1), segment.get(i));
            }
        }
        return GeoDistance.round(meters / 1000.0d, 3);
    }

    /**
     * Average speed over the whole time span in km/h, or {@code 0.0}.
     */
    public double speedKmh() {
        Instant first = firstTime();
        Instant last = lastTime();
        if (first == null || last == null) {
            return 0.0d;
        }
        long seconds = Duration.between(first, last).getSeconds();
        if (seconds == 0) {
            return 0.0d;
        }
        return distanceKm() / seconds * 3600.0d;
    }

    /**
     * Average speed in km/h counting only intervals faster than a walking crawl.
     */
    public double movingSpeedKmh() {
        double movingMeters = 0.0d;
        double movingSeconds = 0.0d;
        for (List<GeoPoint> segment : segments) {
            for (int i = 1; i < segment.size(); i++) {
                GeoPoint previous = segment.get(i - 1);
                GeoPoint current = segment.get(i);
                if (previous.time() == null || current.time() == null) {
                    continue;
                }
                double seconds = Duration.between(previous.time(), current.time()).toMillis() / 1000.0d;
                if (seconds <= 0.0d) {
                    continue;
                }
                double meters = GeoDistance.distanceMeters(previous, current);
                if (meters / seconds * 3.6d > STOPPED_SPEED_KMH) {
                    movingMeters += meters;
                    movingSeconds += seconds;
                }
            }
        }
        if (movingSeconds == 0.0d) {
            return 0.0d;
        }
        return movingMeters / movingSeconds * 3.6d;
    }

    /**
     * Planar angle in degrees {@code [0, 360)} between start and end point.
     *
     * <p>Latitude is normalized by 90 and longitude by 180. Returns {@code 0} without
     * points or when start and end coincide.</p>
     */
    public double bearing() {
        GeoPoint first = firstPoint();
        if (first == null) {
            return 0.0d;
        }
        GeoPoint last = lastPoint();
        double normLat = (first.latitude() - last.latitude()) / 90.0d;
        double normLong = (first.longitude() - last.longitude()) / 180.0d;
        double norm = Math.sqrt(normLat * normLat + normLong * normLong);
        if (norm == 0.0d) {
            return 0.0d;
        }
        double result = Math.toDegrees(Math.asin(normLong / norm));
        if (normLat >= 0.0d) {
            return (360.0d + result) % 360.0d;
        }
        return 180.0d - result;
    }

    /**
     * Cheap content hash over positions, elevations and time of day.
     */
    public double pointsHash() {
        double result = 1.0d;
        for (GeoPoint point : points()) {
            if (point.longitude() != 0.0d) {
                result *= point.longitude();
            }
            if (point.latitude() != 0.0d) {
                result *= point.latitude();
            }
            if (point.elevation() != null && point.elevation() != 0.0d) {
                result *= point.elevation();
            }
            if (point.time() != null) {
                long secondOfDay = Math.floorMod(point.time().getEpochSecond(), 86_400L);
                result *= (secondOfDay / 3600) + 1;
                result *= ((secondOfDay % 3600) / 60) + 1;
                result *= (secondOfDay % 60) + 1;
            }
            result %= HASH_MODULUS;
        }
        return result;
    }

    /**
     * Index of the first point whose position differs, or the common length if all
     * compared points match.
     */
    public int firstDifferentPoint(GeoSequence other) {
        List<GeoPoint> mine = points();
        List<GeoPoint> theirs = other.points();
        int limit = Math.min(mine.size(), theirs.size());
        for (int i = 0; i < limit; i++) {
            GeoPoint a = mine.get(i);
            GeoPoint b = theirs.get(i);
            if (a.longitude() != b.longitude() || a.latitude() != b.latitude()) {
                return i;
            }
        }
        return limit;
    }

    /**
     * True when both sequences have the same point count, a close bearing and
     * positions equal to {@code digits} relative digits. Elevation and time are ignored.
     */
    public boolean pointsEqual(GeoSequence other, int digits) {
        List<GeoPoint> mine = points();
        List<GeoPoint> theirs = other.points();
        if (mine.size() != theirs.size()) {
            return false;
        }
        if (!GeoDistance.isClose(bearing(), other.bearing(), 1.0d / Math.pow(10.0d, digits))) {
            return false;
        }
        for (int i = 0; i < mine.size(); i++) {
            if (!mine.get(i).samePosition(theirs.get(i), digits)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Brute-force search for {@code other} as a contiguous run inside this sequence.
     *
     * @return starting flat index, or {@code -1} if not contained.
     */
    public int indexOf(GeoSequence other, int digits) {
        List<GeoPoint> mine = points();
        List<GeoPoint> theirs = other.points();
        for (int start = 0; start <= mine.size() - theirs.size(); start++) {
            boolean match = true;
            for (int j = 0; j < theirs.size(); j++) {
                if (!mine.get(start + j).samePosition(theirs.get(j), digits)) {
                    match = false;
                    break;
                }
            }
            if (match) {
                return start;
            }
        }
        return -1;
    }

    /**
     * If the first points and the last points of both sequences are offset by the same
     * non-zero duration, returns it; otherwise {@code null}.
     */
    public Duration timeOffset(GeoSequence other) {
        Duration start = offset(firstPoint(), other.firstPoint());
        if (start == null || start.isZero()) {
            return null;
        }
        Duration end = offset(lastPoint(), other.lastPoint());
        return start.equals(end) ? start : null;
    }

    private static Duration offset(GeoPoint mine, GeoPoint theirs) {
        if (mine == null || theirs == null || mine.time() == null || theirs.time() == null) {
            return null;
        }
        return Duration.between(mine.time(), theirs.time());
    }

    /**
     * Set of distinct (longitude, latitude) pairs, packed by {@link GeoPoint#positionKey()}.
     */
    public LongOpenHashSet positionKeys() {
        LongOpenHashSet result = new LongOpenHashSet(pointCount());
        for (List<GeoPoint> segment : segments) {
            for (GeoPoint point : segment) {
                result.add(point.positionKey());
            }
        }
        return result;
    }

    /**
     * Splits segments wherever time goes backwards, jumps forward by more than
     * {@code maxGap}, appears or disappears, or the distance exceeds
     * {@code maxDistanceMeters}. Empty segments are dropped.
     *
     * @return true if the sequence changed.
     */
    public boolean splitAtJumps(Duration maxGap, double maxDistanceMeters) {
        Objects.requireNonNull(maxGap, "maxGap");
        boolean changed = false;
        List<List<GeoPoint>> result = new ArrayList<>();
        for (List<GeoPoint> segment : segments) {
            if (segment.isEmpty()) {
                changed = true;
                continue;
            }
            List<GeoPoint> current = new ArrayList<>();
            current.add(segment.get(0));
            for (int i = 1; i < segment.size(); i++) {
                GeoPoint previous = current.get(current.size() - 1);
                GeoPoint point = segment.get(i);
                if (needsBreak(previous, point, maxGap, maxDistanceMeters)) {
                    changed = true;
                    result.add(current);
                    current = new ArrayList<>();
                }
                current.add(point);
            }
            result.add(current);
        }
        if (changed) {
            segments.clear();
            segments.addAll(result);
        }
        return changed;
    }

    private static boolean needsBreak(GeoPoint previous, GeoPoint point, Duration maxGap, double maxDistanceMeters) {
        if ((point.time() == null) != (previous.time() == null)) {
            return true;
        }
        if (point.time() != null) {
            Duration gap = Duration.between(previous.time(), point.time());
            if (gap.isNegative() || gap.compareTo(maxGap) > 0) {
                return true;
            }
        }
        return GeoDistance.distanceMeters(previous, point) > maxDistanceMeters;
    }

    @Override
    public String toString() {
        return "GeoSequence(" + segments.size() + " segments, " + pointCount() + " points, "
                + waypoints.size() + " waypoints)";
    }
}
