package org.Aayush.tracksync.record;

import org.Aayush.tracksync.core.TrackSyncException;

/**
 * Identity or host invariant violation on a record.
 */
public final class IllegalIdentityChangeException extends TrackSyncException {
    public static final String REASON_UNATTACHED = "UNATTACHED";
    public static final String REASON_CLEAR_SAVED_IDENTITY = "CLEAR_SAVED_IDENTITY";
    public static final String REASON_HOST_CHANGE = "HOST_CHANGE";

    public IllegalIdentityChangeException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
