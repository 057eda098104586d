package org.Aayush.tracksync.record;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.Aayush.tracksync.collection.Capability;

/**
 * Dirty markers for pending write-back.
 *
 * <p>{@link #GPX} stands for bulk geometry edits and always needs a full write.</p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum RecordField {
    TITLE("title", Capability.WRITE_TITLE),
    DESCRIPTION("description", Capability.WRITE_DESCRIPTION),
    CATEGORY("category", Capability.WRITE_CATEGORY),
    VISIBILITY("public", Capability.WRITE_VISIBILITY),
    TAGS("keywords", Capability.WRITE_TAGS),
    CROSS_IDS("ids", Capability.WRITE_CROSS_IDS),
    GPX("gpx", null);

    /** Short name used in log lines and adapter messages. */
    private final String markerName;
    /** Capability allowing a field-level write, {@code null} if only a full write applies. */
    private final Capability writeCapability;
}
