package org.Aayush.tracksync.codec;

import org.Aayush.tracksync.core.TrackSyncException;

/**
 * A plain tag used one of the prefixes reserved for typed fields.
 */
public final class ReservedKeywordException extends TrackSyncException {
    public static final String REASON = "RESERVED_KEYWORD";

    public ReservedKeywordException(String message) {
        super(REASON, message);
    }
}
