package org.Aayush.tracksync.geo;

import lombok.experimental.UtilityClass;

/**
 * Numeric helpers for geographic distance and rounding.
 */
@UtilityClass
public class GeoDistance {
    private static final double EARTH_MEAN_RADIUS_METERS = 6_371_008.8d;

    /**
     * Computes great-circle distance in meters using haversine formulation.
     */
    public static double greatCircleDistanceMeters(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double clampedA = clamp(a, 0.0d, 1.0d);
        double c = 2.0d * Math.asin(Math.sqrt(clampedA));
        return EARTH_MEAN_RADIUS_METERS * c;
    }

    /**
     * Great-circle distance between two points in meters.
     */
    public static double distanceMeters(GeoPoint from, GeoPoint to) {
        return greatCircleDistanceMeters(from.latitude(), from.longitude(), to.latitude(), to.longitude());
    }

    /**
     * Projects {@code point} onto a local plane centered at {@code origin}.
     *
     * @return {@code [x, y]} in meters, x growing east and y growing north.
     */
    static double[] localMeters(GeoPoint origin, GeoPoint point) {
        double metersPerDegree = Math.toRadians(1.0d) * EARTH_MEAN_RADIUS_METERS;
        double x = normalizeDeltaLongitudeDegrees(point.longitude() - origin.longitude())
                * Math.cos(Math.toRadians(origin.latitude())) * metersPerDegree;
        double y = (point.latitude() - origin.latitude()) * metersPerDegree;
        return new double[]{x, y};
    }

    /**
     * Normalizes delta-longitude into the principal range {@code (-180, 180]}.
     */
    static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    /**
     * Rounds half away from zero to the given number of decimal digits.
     */
    public static double round(double value, int digits) {
        if (digits < 0) {
            throw new IllegalArgumentException("digits must be >= 0");
        }
        if (!Double.isFinite(value)) {
            return value;
        }
        double scale = Math.pow(10.0d, digits);
        return Math.round(value * scale) / scale;
    }

    /**
     * Relative closeness test: {@code |a-b| <= relTol * max(|a|, |b|)}.
     */
    public static boolean isClose(double a, double b, double relTol) {
        if (a == b) {
            return true;
        }
        return Math.abs(a - b) <= relTol * Math.max(Math.abs(a), Math.abs(b));
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
