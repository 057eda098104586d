package org.Aayush.tracksync.merge;

import lombok.Builder;
import lombok.Value;

/**
 * Switches for {@link MergeEngine} and {@link CollectionMerger}.
 */
@Value
@Builder(toBuilder = true)
public class MergeOptions {
    /** Remove the merged source record afterwards. */
    boolean remove;
    /** Produce all messages but change nothing. */
    boolean dryRun;
    /** Accept records where one point list is a contiguous part of the other. */
    boolean partialTracks;
    /** Collection merge only: copy every source record without looking for matches. */
    boolean copy;
    /** Relative digits used when comparing positions. */
    @Builder.Default
    int positionDigits = 4;

    public static MergeOptions defaults() {
        return MergeOptions.builder().build();
    }
}
