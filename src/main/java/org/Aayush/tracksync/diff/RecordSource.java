package org.Aayush.tracksync.diff;

import org.Aayush.tracksync.collection.AbstractRecordCollection;
import org.Aayush.tracksync.collection.RecordCollection;
import org.Aayush.tracksync.record.Record;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Where records to compare or merge come from: one record, one collection, or a
 * list of sources.
 *
 * <p>{@link #flatten()} resolves the tree once into a plain record list.</p>
 */
public final class RecordSource {

    public enum Kind {
        RECORD,
        COLLECTION,
        LIST
    }

    private final Kind kind;
    private final Record record;
    private final RecordCollection collection;
    private final List<RecordSource> children;

    private RecordSource(Kind kind, Record record, RecordCollection collection, List<RecordSource> children) {
        this.kind = kind;
        this.record = record;
        this.collection = collection;
        this.children = children;
    }

    public static RecordSource of(Record record) {
        return new RecordSource(Kind.RECORD, Objects.requireNonNull(record, "record"), null, List.of());
    }

    public static RecordSource of(RecordCollection collection) {
        return new RecordSource(Kind.COLLECTION, null, Objects.requireNonNull(collection, "collection"), List.of());
    }

    public static RecordSource of(List<RecordSource> sources) {
        return new RecordSource(Kind.LIST, null, null, List.copyOf(Objects.requireNonNull(sources, "sources")));
    }

    /**
     * List source over plain records.
     */
    public static RecordSource ofRecords(List<Record> records) {
        Objects.requireNonNull(records, "records");
        List<RecordSource> sources = new ArrayList<>(records.size());
        for (Record item : records) {
            sources.add(of(item));
        }
        return of(sources);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * All records in source order.
     *
     * <p>Collections deriving from {@link AbstractRecordCollection} contribute their
     * cached records, other collections a fresh listing.</p>
     */
    public List<Record> flatten() {
        List<Record> result = new ArrayList<>();
        collect(result);
        return result;
    }

    private void collect(List<Record> result) {
        switch (kind) {
            case RECORD -> result.add(record);
            case COLLECTION -> result.addAll(collection instanceof AbstractRecordCollection
                    ? ((AbstractRecordCollection) collection).records()
                    : collection.list());
            case LIST -> children.forEach(child -> child.collect(result));
        }
    }
}
