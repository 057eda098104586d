package org.Aayush.tracksync.collection;

import org.Aayush.tracksync.core.SyncScope;
import org.Aayush.tracksync.record.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base class for collections holding the user-facing record list.
 *
 * <p>The listing is fetched lazily on first access and cached. Subclasses implement
 * the storage calls of {@link RecordCollection} plus {@link #removeStored(String)} and
 * {@link #renameStored(String, String)}; this class keeps the cache in step.</p>
 */
public abstract class AbstractRecordCollection implements RecordCollection {
    private static final Logger log = LoggerFactory.getLogger(AbstractRecordCollection.class);

    private final String identifier;
    private List<Record> cache;

    protected AbstractRecordCollection(String identifier) {
        String normalized = Objects.requireNonNull(identifier, "identifier").trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("identifier must be non-blank");
        }
        this.identifier = normalized;
    }

    @Override
    public final String identifier() {
        return identifier;
    }

    /**
     * All records, listed once and cached.
     */
    public List<Record> records() {
        return List.copyOf(cached());
    }

    public int size() {
        return cached().size();
    }

    /**
     * Record with {@code identity}, or {@code null}.
     */
    public Record find(String identity) {
        for (Record record : cached()) {
            if (record.identity() != null && record.identity().equals(identity)) {
                return record;
            }
        }
        return null;
    }

    /**
     * Drops the cached listing; the next access lists again.
     */
    public void scan() {
        cache = null;
    }

    /**
     * Stores {@code record} here.
     *
     * <p>An unattached record is attached and written. A record hosted elsewhere is
     * left alone and a detached copy is stored instead.</p>
     *
     * @return the stored record.
     * @throws UnsupportedCapabilityException if this collection cannot write.
     */
    public Record add(Record record) {
        Objects.requireNonNull(record, "record");
        if (record.host() == this) {
            return record;
        }
        if (!supports(Capability.WRITE_FULL)) {
            throw new UnsupportedCapabilityException(Capability.WRITE_FULL, identifier + ": add is not supported");
        }
        // list before writing, or the new record would be listed twice
        List<Record> listing = cached();
        Record target = record.isAttached() ? record.detachedCopy() : record;
        target.attach(this);
        try {
            target.rewrite();
        } catch (RuntimeException e) {
            try (SyncScope ignored = target.decouple()) {
                target.detach();
            }
            throw e;
        }
        listing.add(target);
        log.info("{}: added {}", identifier, target);
        return target;
    }

    /**
     * Removes {@code record}, which must be hosted here.
     */
    public void remove(Record record) {
        Objects.requireNonNull(record, "record");
        if (record.host() != this) {
            throw new IllegalArgumentException(record + " is not hosted by " + identifier);
        }
        record.remove();
    }

    /**
     * Removes every record.
     */
    public void clear() {
        for (Record record : records()) {
            remove(record);
        }
    }

    @Override
    public final void remove(String identity) {
        Objects.requireNonNull(identity, "identity");
        removeStored(identity);
        if (cache != null) {
            cache.removeIf(record -> identity.equals(record.identity()));
        }
        log.info("{}: removed {}", identifier, identity);
    }

    @Override
    public final void rename(Record record, String newIdentity) {
        Objects.requireNonNull(record, "record");
        String oldIdentity = Objects.requireNonNull(record.identity(), "record.identity");
        String finalIdentity = renameStored(oldIdentity, newIdentity);
        try (SyncScope ignored = record.decouple()) {
            record.setIdentity(finalIdentity);
        }
        log.info("{}: renamed {} to {}", identifier, oldIdentity, finalIdentity);
    }

    /**
     * Deletes stored data for {@code identity}.
     */
    protected void removeStored(String identity) {
        throw new UnsupportedCapabilityException(Capability.REMOVE, identifier + ": remove is not supported");
    }

    /**
     * Moves stored data to {@code newIdentity}.
     *
     * @return identity actually used.
     */
    protected String renameStored(String oldIdentity, String newIdentity) {
        throw new UnsupportedCapabilityException(Capability.RENAME, identifier + ": rename is not supported");
    }

    private List<Record> cached() {
        if (cache == null) {
            cache = supports(Capability.LIST) ? new ArrayList<>(list()) : new ArrayList<>();
        }
        return cache;
    }

    @Override
    public String toString() {
        return identifier;
    }
}
