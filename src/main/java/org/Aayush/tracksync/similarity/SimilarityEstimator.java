package org.Aayush.tracksync.similarity;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.Aayush.tracksync.core.ValidationException;
import org.Aayush.tracksync.geo.GeoPoint;
import org.Aayush.tracksync.geo.GeoSequence;
import org.Aayush.tracksync.geo.PolylineSimplifier;

import java.util.List;
import java.util.Objects;

/**
 * Approximate likeness of two geometries in {@code [0, 1]}, where 1 means identical.
 *
 * <p>Both point lists are simplified, rounded and compared as position sets. The score
 * is the length similarity of the simplified lists times the share of the smaller set
 * found in the other one. Two empty geometries, or one empty one, score 0.</p>
 *
 * <p>Instances are immutable and thread-safe. Results are not cached here;
 * {@link org.Aayush.tracksync.record.Record#similarity(org.Aayush.tracksync.record.Record)}
 * caches them per record pair.</p>
 */
public final class SimilarityEstimator {
    private static final SimilarityEstimator DEFAULT = new SimilarityEstimator(SimilarityConfig.defaults());

    private final SimilarityConfig config;
    private final double scale;

    public SimilarityEstimator(SimilarityConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        if (!(config.getSimplifyMaxDistanceMeters() >= 0.0d)) {
            throw new ValidationException(ValidationException.REASON_INVALID_CONFIG, "simplifyMaxDistanceMeters must be >= 0");
        }
        if (config.getRoundingDigits() < 0 || config.getRoundingDigits() > 6) {
            throw new ValidationException(ValidationException.REASON_INVALID_CONFIG, "roundingDigits must be in [0, 6]");
        }
        this.scale = Math.pow(10.0d, config.getRoundingDigits());
    }

    public static SimilarityEstimator defaults() {
        return DEFAULT;
    }

    public SimilarityConfig config() {
        return config;
    }

    public double estimate(GeoSequence first, GeoSequence second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        List<GeoPoint> simple1 = PolylineSimplifier.simplify(first.points(), config.getSimplifyMaxDistanceMeters());
        List<GeoPoint> simple2 = PolylineSimplifier.simplify(second.points(), config.getSimplifyMaxDistanceMeters());
        if (simple1.isEmpty() || simple2.isEmpty()) {
            return 0.0d;
        }
        int maxLength = Math.max(simple1.size(), simple2.size());
        double similarLength = 1.0d - Math.abs(simple1.size() - simple2.size()) / (double) maxLength;

        LongOpenHashSet set1 = roundedPositions(simple1);
        LongOpenHashSet set2 = roundedPositions(simple2);
        LongOpenHashSet smaller = set1.size() <= set2.size() ? set1 : set2;
        LongOpenHashSet larger = smaller == set1 ? set2 : set1;
        int shared = 0;
        for (long key : smaller) {
            if (larger.contains(key)) {
                shared++;
            }
        }
        return similarLength * shared / smaller.size();
    }

    private LongOpenHashSet roundedPositions(List<GeoPoint> points) {
        LongOpenHashSet result = new LongOpenHashSet(points.size());
        for (GeoPoint point : points) {
            long lat = Math.round(point.latitude() * scale);
            long lon = Math.round(point.longitude() * scale);
            result.add((lat << 32) ^ (lon & 0xFFFF_FFFFL));
        }
        return result;
    }
}
