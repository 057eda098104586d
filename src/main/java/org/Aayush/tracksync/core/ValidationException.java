package org.Aayush.tracksync.core;

/**
 * Raised when a value is rejected before any state is touched.
 */
public class ValidationException extends TrackSyncException {
    public static final String REASON_INVALID_CATEGORY = "INVALID_CATEGORY";
    public static final String REASON_INVALID_VISIBILITY = "INVALID_VISIBILITY";
    public static final String REASON_INVALID_TAG = "INVALID_TAG";
    public static final String REASON_DUPLICATE_TAG = "DUPLICATE_TAG";
    public static final String REASON_INVALID_CROSS_IDS = "INVALID_CROSS_IDS";
    public static final String REASON_INVALID_IDENTITY = "INVALID_IDENTITY";
    public static final String REASON_NOT_DECOUPLED = "NOT_DECOUPLED";
    public static final String REASON_INVALID_CONFIG = "INVALID_CONFIG";

    public ValidationException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public ValidationException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
