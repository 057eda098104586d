package org.Aayush.tracksync.merge;

import org.Aayush.tracksync.core.TrackSyncException;

/**
 * Two records do not share their geometry closely enough to be merged.
 */
public final class CannotMergeException extends TrackSyncException {
    public static final String REASON_SAME_RECORD = "SAME_RECORD";
    public static final String REASON_GEOMETRY_MISMATCH = "GEOMETRY_MISMATCH";

    public CannotMergeException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
