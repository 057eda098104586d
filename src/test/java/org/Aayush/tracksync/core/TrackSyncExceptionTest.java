package org.Aayush.tracksync.core;

import org.Aayush.tracksync.collection.Capability;
import org.Aayush.tracksync.collection.UnsupportedCapabilityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("TrackSyncException Tests")
class TrackSyncExceptionTest {

    @Test
    @DisplayName("Three-arg constructor preserves reason code, message prefix, and cause")
    void testThreeArgConstructor() {
        IllegalStateException cause = new IllegalStateException("boom");
        TrackSyncException ex = new TrackSyncException("TEST_REASON", "details", cause);

        assertEquals("TEST_REASON", ex.reasonCode());
        assertEquals("[TEST_REASON] details", ex.getMessage());
        assertSame(cause, ex.getCause());
    }

    @Test
    @DisplayName("Blank reason code is rejected")
    void testBlankReasonCodeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TrackSyncException(" ", "details"));
    }

    @Test
    @DisplayName("Capability failures derive their reason from the capability")
    void testCapabilityReason() {
        UnsupportedCapabilityException missing = new UnsupportedCapabilityException(Capability.RENAME, "no rename");
        UnsupportedCapabilityException unattached = new UnsupportedCapabilityException(
                UnsupportedCapabilityException.REASON_REMOVE_UNATTACHED, "nothing to remove");

        assertEquals("UNSUPPORTED_RENAME", missing.reasonCode());
        assertSame(Capability.RENAME, missing.capability());
        assertEquals("REMOVE_UNATTACHED", unattached.reasonCode());
        assertNull(unattached.capability());
    }
}
