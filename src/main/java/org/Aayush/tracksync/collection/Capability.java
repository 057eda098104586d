package org.Aayush.tracksync.collection;

/**
 * Operations a collection may or may not support.
 *
 * <p>Each collection declares its set explicitly through
 * {@link RecordCollection#capabilities()}.</p>
 */
public enum Capability {
    /** List header-populated records. */
    LIST,
    /** Populate a header-only record completely. */
    READ_FULL,
    /** Write a whole record, possibly assigning a new identity. */
    WRITE_FULL,
    WRITE_TITLE,
    WRITE_DESCRIPTION,
    WRITE_CATEGORY,
    WRITE_VISIBILITY,
    WRITE_TAGS,
    WRITE_CROSS_IDS,
    /** Delete a record by identity. */
    REMOVE,
    /** Change the identity of a stored record. */
    RENAME
}
