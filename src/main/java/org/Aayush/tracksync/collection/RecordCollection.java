package org.Aayush.tracksync.collection;

import org.Aayush.tracksync.record.Record;
import org.Aayush.tracksync.record.RecordField;

import java.util.List;
import java.util.Set;

/**
 * Storage adapter contract for hosting records.
 *
 * <p>The core calls only these methods. Every default implementation fails with
 * {@link UnsupportedCapabilityException}; an adapter overrides what it supports and
 * declares the same set in {@link #capabilities()}.</p>
 *
 * <p>Implementations are not required to be thread-safe. Callers sharing one
 * instance across threads must serialize access.</p>
 */
public interface RecordCollection {

    /**
     * Stable identifier of the physical store, for example {@code memory:scratch}.
     *
     * <p>Two instances pointing to the same store return the same identifier. Used as
     * origin in cross ids.</p>
     */
    String identifier();

    /**
     * Declared capability set. Must be constant for the lifetime of the instance.
     */
    Set<Capability> capabilities();

    /**
     * Convenience membership test on {@link #capabilities()}.
     */
    default boolean supports(Capability capability) {
        return capabilities().contains(capability);
    }

    /**
     * Lists all stored records.
     *
     * @return attached records with only header fields populated.
     */
    default List<Record> list() {
        throw new UnsupportedCapabilityException(Capability.LIST, identifier() + ": list is not supported");
    }

    /**
     * Populates every field of {@code record}.
     *
     * <p>Called while the record is decoupled, so setters invoked here only change
     * memory. The core marks the record loaded after this returns normally.</p>
     */
    default void readFull(Record record) {
        throw new UnsupportedCapabilityException(Capability.READ_FULL, identifier() + ": read is not supported");
    }

    /**
     * Writes the whole record.
     *
     * <p>During this call {@link Record#rawTags()} carries the encoded attribute string.</p>
     *
     * @param desiredIdentity wanted identity, or {@code null} to let the store choose.
     * @return identity under which the record was stored.
     */
    default String writeFull(Record record, String desiredIdentity) {
        throw new UnsupportedCapabilityException(Capability.WRITE_FULL, identifier() + ": write is not supported");
    }

    /**
     * Writes a single field of an already stored record.
     */
    default void writeField(Record record, RecordField field) {
        throw new UnsupportedCapabilityException(
                field.writeCapability() == null ? Capability.WRITE_FULL : field.writeCapability(),
                identifier() + ": writing " + field.markerName() + " is not supported");
    }

    /**
     * Deletes the record stored under {@code identity}.
     */
    default void remove(String identity) {
        throw new UnsupportedCapabilityException(Capability.REMOVE, identifier() + ": remove is not supported");
    }

    /**
     * Changes the identity of a stored record.
     *
     * <p>Implementations assign the final identity through {@link Record#setIdentity(String)};
     * the record is decoupled during this call.</p>
     */
    default void rename(Record record, String newIdentity) {
        throw new UnsupportedCapabilityException(Capability.RENAME, identifier() + ": rename is not supported");
    }
}
