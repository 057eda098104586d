package org.Aayush.tracksync.diff;

import org.Aayush.tracksync.core.ValidationException;
import org.Aayush.tracksync.record.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compares two record sources.
 *
 * <p>Matching runs in two passes and every record is matched at most once:</p>
 * <ol>
 *   <li>Identical: left and right have the same {@link Record#equalityKey()}. The
 *   first unmatched right record in source order wins.</li>
 *   <li>Similar: among the still unmatched right records, the one sharing the most
 *   distinct positions with the left record, if at least
 *   {@link DiffConfig#getMinSharedPositions()}. Ties go to the earlier right record.</li>
 * </ol>
 *
 * <p>Left records are visited in source order, so the outcome is deterministic for a
 * given order of both sources. Everything left unmatched is exclusive to its side.</p>
 */
public final class CollectionDiff {
    private static final Logger log = LoggerFactory.getLogger(CollectionDiff.class);

    private final DiffSide left;
    private final DiffSide right;
    private final List<Record> identical = new ArrayList<>();
    private final List<RecordPair> similar = new ArrayList<>();

    public CollectionDiff(RecordSource left, RecordSource right) {
        this(left, right, DiffConfig.defaults());
    }

    public CollectionDiff(RecordSource left, RecordSource right, DiffConfig config) {
        Objects.requireNonNull(config, "config");
        if (config.getMinSharedPositions() < 1) {
            throw new ValidationException(ValidationException.REASON_INVALID_CONFIG, "minSharedPositions must be >= 1");
        }
        this.left = new DiffSide(left);
        this.right = new DiffSide(right);
        match(config);
    }

    public DiffSide left() {
        return left;
    }

    public DiffSide right() {
        return right;
    }

    /**
     * Left records that have an identical right counterpart.
     */
    public List<Record> identical() {
        return Collections.unmodifiableList(identical);
    }

    /**
     * Pairs of records with enough shared positions but not identical.
     */
    public List<RecordPair> similar() {
        return Collections.unmodifiableList(similar);
    }

    public boolean isEmpty() {
        return similar.isEmpty() && left.exclusive().isEmpty() && right.exclusive().isEmpty();
    }

    private void match(DiffConfig config) {
        Map<Record, Boolean> matched = new IdentityHashMap<>();
        Map<Record, String> keys = new IdentityHashMap<>();
        for (Record record : left.records()) {
            keys.put(record, record.equalityKey());
        }
        for (Record record : right.records()) {
            keys.put(record, record.equalityKey());
        }

        for (Record leftRecord : left.records()) {
            for (Record rightRecord : right.records()) {
                if (!matched.containsKey(rightRecord) && keys.get(leftRecord).equals(keys.get(rightRecord))) {
                    log.debug("identical: {} = {}", leftRecord, rightRecord);
                    identical.add(leftRecord);
                    matched.put(leftRecord, Boolean.TRUE);
                    matched.put(rightRecord, Boolean.TRUE);
                    break;
                }
            }
        }

        for (Record leftRecord : left.records()) {
            if (matched.containsKey(leftRecord)) {
                continue;
            }
            Record best = null;
            int bestShared = -1;
            for (Record rightRecord : right.records()) {
                if (matched.containsKey(rightRecord)) {
                    continue;
                }
                int shared = DiffSide.sharedPositions(left.positions(leftRecord), right.positions(rightRecord));
                if (shared >= config.getMinSharedPositions() && shared > bestShared) {
                    best = rightRecord;
                    bestShared = shared;
                }
            }
            if (best != null) {
                log.debug("similar: {} ~ {} sharing {} positions", leftRecord, best, bestShared);
                similar.add(new RecordPair(leftRecord, best, config));
                matched.put(leftRecord, Boolean.TRUE);
                matched.put(best, Boolean.TRUE);
            }
        }

        for (Record record : left.records()) {
            if (!matched.containsKey(record)) {
                left.addExclusive(record);
            }
        }
        for (Record record : right.records()) {
            if (!matched.containsKey(record)) {
                right.addExclusive(record);
            }
        }
    }
}
