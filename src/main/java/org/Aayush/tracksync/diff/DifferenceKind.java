package org.Aayush.tracksync.diff;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Buckets of differences between two similar records, each with a one-letter flag.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum DifferenceKind {
    TITLE('T'),
    DESCRIPTION('D'),
    CATEGORY('C'),
    VISIBILITY('S'),
    KEYWORDS('K'),
    POSITIONS('P'),
    TIME_OFFSET('Z');

    private final char flag;
}
