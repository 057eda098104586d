package org.Aayush.tracksync.diff;

import lombok.Builder;
import lombok.Value;

/**
 * Tuning for {@link CollectionDiff} and {@link RecordPair}.
 */
@Value
@Builder
public class DiffConfig {
    /** Shared distinct positions needed to call two records similar. */
    @Builder.Default
    int minSharedPositions = 100;

    /** List every differing point pair of a replaced run. */
    @Builder.Default
    boolean verbose = false;

    public static DiffConfig defaults() {
        return DiffConfig.builder().build();
    }
}
