package org.Aayush.tracksync.merge;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of {@link MergeEngine#canMerge}.
 *
 * <p>When mergeable, {@code offset} is the flat point index where the shorter point
 * list starts inside the longer one and {@code otherInSelf} tells which one is longer.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MergeCheck {
    boolean mergeable;
    int offset;
    boolean otherInSelf;
    String reasonCode;
    String reason;

    static MergeCheck at(int offset, boolean otherInSelf) {
        return new MergeCheck(true, offset, otherInSelf, null, null);
    }

    static MergeCheck rejected(String reasonCode, String reason) {
        return new MergeCheck(false, -1, false, reasonCode, reason);
    }
}
