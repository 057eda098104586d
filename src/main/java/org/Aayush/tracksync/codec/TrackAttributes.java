package org.Aayush.tracksync.codec;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Typed view of the fields multiplexed into a record's tag string.
 */
@Value
@Builder(toBuilder = true)
public class TrackAttributes {
    /** Record category; the codec default is {@link Category#defaultCategory()}. */
    @Builder.Default
    Category category = Category.defaultCategory();
    /** True for public, false for private. */
    boolean visible;
    /** Cross-collection identifiers, newest first. */
    @Builder.Default
    List<String> crossIds = List.of();
    /** Plain tags, sorted and free of reserved prefixes. */
    @Builder.Default
    List<String> tags = List.of();

    /**
     * Returns attributes with every field at its default.
     */
    public static TrackAttributes defaults() {
        return TrackAttributes.builder().build();
    }
}
