package org.Aayush.tracksync.collection;

import org.Aayush.tracksync.core.TrackSyncException;

/**
 * Opaque failure raised at the collection boundary.
 *
 * <p>The core passes these through unchanged and never retries.</p>
 */
public class StorageException extends TrackSyncException {
    public static final String REASON_STORAGE_FAILURE = "STORAGE_FAILURE";
    public static final String REASON_UNKNOWN_IDENTITY = "UNKNOWN_IDENTITY";
    public static final String REASON_MALFORMED_GPX = "MALFORMED_GPX";

    public StorageException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public StorageException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
