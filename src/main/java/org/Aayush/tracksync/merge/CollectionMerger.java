package org.Aayush.tracksync.merge;

import org.Aayush.tracksync.collection.AbstractRecordCollection;
import org.Aayush.tracksync.diff.RecordSource;
import org.Aayush.tracksync.record.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Merges records from a source into a target collection.
 *
 * <p>Records are grouped by {@link Record#pointsHash()}. Source records whose hash the
 * target does not have are copied, or moved with {@link MergeOptions#isRemove()}. The
 * others are merged into the first target record with that hash; further target records
 * with the same hash are merged into it as well. With {@link MergeOptions#isCopy()}
 * every source record is copied without matching.</p>
 */
public final class CollectionMerger {
    private static final Logger log = LoggerFactory.getLogger(CollectionMerger.class);

    private final MergeOptions options;
    private final MergeEngine engine;

    public CollectionMerger(MergeOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.engine = new MergeEngine(options);
    }

    /**
     * @return messages for verbose output, one or more per action.
     */
    public List<String> merge(AbstractRecordCollection target, RecordSource source) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(source, "source");
        List<Record> incoming = new ArrayList<>();
        for (Record record : source.flatten()) {
            if (record.host() == null || !target.identifier().equals(record.host().identifier())) {
                incoming.add(record);
            }
        }
        if (options.isCopy()) {
            List<String> result = new ArrayList<>();
            for (Record record : incoming) {
                result.add(copy(target, record));
            }
            return result;
        }

        Map<Double, Record> targets = new LinkedHashMap<>();
        TreeMap<Double, List<Record>> sources = new TreeMap<>();
        for (Record record : target.records()) {
            Record first = targets.putIfAbsent(record.pointsHash(), record);
            if (first != null) {
                sources.computeIfAbsent(record.pointsHash(), key -> new ArrayList<>()).add(record);
            }
        }
        for (Record record : incoming) {
            sources.computeIfAbsent(record.pointsHash(), key -> new ArrayList<>()).add(record);
        }

        List<String> result = new ArrayList<>();
        for (Map.Entry<Double, List<Record>> entry : sources.entrySet()) {
            if (!targets.containsKey(entry.getKey())) {
                for (Record record : entry.getValue()) {
                    result.add(copy(target, record));
                }
            }
        }
        for (Map.Entry<Double, List<Record>> entry : sources.entrySet()) {
            Record into = targets.get(entry.getKey());
            if (into != null) {
                for (Record record : entry.getValue()) {
                    result.addAll(engine.merge(into, record));
                }
            }
        }
        log.info("{}: merge produced {} messages", target, result.size());
        return result;
    }

    private String copy(AbstractRecordCollection target, Record record) {
        String from = record.toString();
        String to = target.identifier();
        if (!options.isDryRun()) {
            boolean hostedElsewhere = record.isAttached();
            to = target.add(record).toString();
            if (options.isRemove() && hostedElsewhere) {
                record.remove();
            }
        }
        return (options.isRemove() ? "move " : "copy ") + from + " -> " + to;
    }
}
