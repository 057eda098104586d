package org.Aayush.tracksync.similarity;

import lombok.Builder;
import lombok.Value;

/**
 * Tuning for {@link SimilarityEstimator}.
 */
@Value
@Builder
public class SimilarityConfig {
    /** Points nearer than this to the simplified polyline are dropped. */
    @Builder.Default
    double simplifyMaxDistanceMeters = 50.0d;

    /** Decimal digits kept from latitude and longitude before set comparison. */
    @Builder.Default
    int roundingDigits = 3;

    public static SimilarityConfig defaults() {
        return SimilarityConfig.builder().build();
    }
}
