package org.Aayush.tracksync.codec;

import org.Aayush.tracksync.core.TrackSyncException;

/**
 * A raw tag string carried the same single-valued reserved prefix more than once.
 */
public final class DuplicateKeywordException extends TrackSyncException {
    public static final String REASON = "DUPLICATE_KEYWORD";

    public DuplicateKeywordException(String message) {
        super(REASON, message);
    }
}
