package org.Aayush.tracksync.geo;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ramer-Douglas-Peucker polyline simplification with a distance threshold in meters.
 *
 * <p>Distances are measured against the infinite line through the range end points,
 * projected onto a local plane centered at the range start.</p>
 */
@UtilityClass
public class PolylineSimplifier {

    /**
     * Simplifies {@code points}, keeping first and last point.
     *
     * @param points ordered input points.
     * @param maxDistanceMeters points closer than this to the current chord are dropped.
     * @return simplified points in input order.
     */
    public static List<GeoPoint> simplify(List<GeoPoint> points, double maxDistanceMeters) {
        Objects.requireNonNull(points, "points");
        if (!(maxDistanceMeters >= 0.0d)) {
            throw new IllegalArgumentException("maxDistanceMeters must be >= 0");
        }
        int size = points.size();
        if (size < 3) {
            return new ArrayList<>(points);
        }
        boolean[] keep = new boolean[size];
        keep[0] = true;
        keep[size - 1] = true;

        IntArrayList stack = new IntArrayList();
        stack.push(0);
        stack.push(size - 1);
        while (!stack.isEmpty()) {
            int end = stack.popInt();
            int begin = stack.popInt();
            if (end - begin < 2) {
                continue;
            }
            double maxDistance = -1.0d;
            int maxIndex = -1;
            for (int i = begin + 1; i < end; i++) {
                double distance = distanceFromLine(points.get(i), points.get(begin), points.get(end));
                if (distance > maxDistance) {
                    maxDistance = distance;
                    maxIndex = i;
                }
            }
            if (maxDistance >= maxDistanceMeters) {
                keep[maxIndex] = true;
                stack.push(begin);
                stack.push(maxIndex);
                stack.push(maxIndex);
                stack.push(end);
            }
        }

        List<GeoPoint> result = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            if (keep[i]) {
                result.add(points.get(i));
            }
        }
        return result;
    }

    static double distanceFromLine(GeoPoint point, GeoPoint lineStart, GeoPoint lineEnd) {
        double[] end = GeoDistance.localMeters(lineStart, lineEnd);
        double[] p = GeoDistance.localMeters(lineStart, point);
        double length = Math.hypot(end[0], end[1]);
        if (length == 0.0d) {
            return Math.hypot(p[0], p[1]);
        }
        return Math.abs(end[0] * p[1] - end[1] * p[0]) / length;
    }
}
