package org.Aayush.tracksync.diff;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.Aayush.tracksync.record.Record;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One side of a {@link CollectionDiff}: its records, their distinct position sets and,
 * after matching, the records found only on this side.
 */
public final class DiffSide {
    private final List<Record> records;
    private final Map<Record, LongOpenHashSet> positions = new IdentityHashMap<>();
    private final List<Record> exclusive = new ArrayList<>();

    DiffSide(RecordSource source) {
        this.records = List.copyOf(Objects.requireNonNull(source, "source").flatten());
        for (Record record : records) {
            positions.put(record, record.geo().positionKeys());
        }
    }

    public List<Record> records() {
        return records;
    }

    /**
     * Records without a counterpart on the other side.
     */
    public List<Record> exclusive() {
        return Collections.unmodifiableList(exclusive);
    }

    LongOpenHashSet positions(Record record) {
        return positions.get(record);
    }

    void addExclusive(Record record) {
        exclusive.add(record);
    }

    /**
     * Number of distinct positions two records share.
     */
    static int sharedPositions(LongOpenHashSet first, LongOpenHashSet second) {
        LongOpenHashSet smaller = first.size() <= second.size() ? first : second;
        LongOpenHashSet larger = smaller == first ? second : first;
        int shared = 0;
        for (long key : smaller) {
            if (larger.contains(key)) {
                shared++;
            }
        }
        return shared;
    }
}
