package org.Aayush.tracksync.record;

import lombok.Builder;
import lombok.Value;
import org.Aayush.tracksync.codec.Category;

import java.time.Instant;
import java.util.List;

/**
 * Summary fields known from a collection listing before a record is fully loaded.
 *
 * <p>A {@code null} entry means the listing did not provide that field; reading it
 * from the record triggers a full load.</p>
 */
@Value
@Builder(toBuilder = true)
public class RecordHeader {
    private static final RecordHeader EMPTY = RecordHeader.builder().build();

    String title;
    String description;
    Category category;
    Boolean visible;
    List<String> tags;
    List<String> crossIds;
    Instant firstTime;
    Double distanceKm;

    public static RecordHeader empty() {
        return EMPTY;
    }

    /**
     * Returns a copy without the entry backing {@code field}.
     */
    RecordHeader without(RecordField field) {
        return switch (field) {
            case TITLE -> toBuilder().title(null).build();
            case DESCRIPTION -> toBuilder().description(null).build();
            case CATEGORY -> toBuilder().category(null).build();
            case VISIBILITY -> toBuilder().visible(null).build();
            case TAGS -> toBuilder().tags(null).build();
            case CROSS_IDS -> toBuilder().crossIds(null).build();
            case GPX -> toBuilder().firstTime(null).distanceKm(null).build();
        };
    }
}
