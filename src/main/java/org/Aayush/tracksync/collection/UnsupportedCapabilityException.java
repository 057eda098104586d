package org.Aayush.tracksync.collection;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.tracksync.core.TrackSyncException;

/**
 * A collection was asked for an operation outside its declared capabilities.
 */
@Getter
@Accessors(fluent = true)
public final class UnsupportedCapabilityException extends TrackSyncException {
    public static final String REASON_REMOVE_UNATTACHED = "REMOVE_UNATTACHED";

    /** Missing capability, {@code null} when the failure is not tied to one. */
    private final Capability capability;

    public UnsupportedCapabilityException(Capability capability, String message) {
        super("UNSUPPORTED_" + capability.name(), message);
        this.capability = capability;
    }

    public UnsupportedCapabilityException(String reasonCode, String message) {
        super(reasonCode, message);
        this.capability = null;
    }
}
