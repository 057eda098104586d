package org.Aayush.tracksync.merge;

import org.Aayush.tracksync.codec.CrossIds;
import org.Aayush.tracksync.core.SyncScope;
import org.Aayush.tracksync.core.time.TimeFormats;
import org.Aayush.tracksync.geo.GeoPoint;
import org.Aayush.tracksync.geo.GeoSequence;
import org.Aayush.tracksync.geo.Waypoint;
import org.Aayush.tracksync.record.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges one record into another.
 *
 * <p>All changes to the target go through its ordinary setters inside one
 * {@link Record#batchChanges()} scope, so a merge costs at most one write-back.</p>
 *
 * <p>Policy, applied in this order:</p>
 * <ol>
 *   <li>Geometry: the target takes the other segments when the other has more points.
 *   Otherwise missing point times are copied from aligned points of the other record.</li>
 *   <li>Waypoints at positions the target does not have yet are appended.</li>
 *   <li>Title: taken from the other record when the target title is empty, or when the
 *   target title looks default and the other one does not.</li>
 *   <li>Description: a different other description is appended on a new line.</li>
 *   <li>Visibility: public if either is public.</li>
 *   <li>Category: a mismatch is only reported.</li>
 *   <li>Tags are united; cross ids are united and cleaned.</li>
 * </ol>
 */
public final class MergeEngine {
    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private static final String DEFAULT_TITLE_CHARS = "0123456789 :-_";
    private static final String INDENT = "     ";

    private final MergeOptions options;

    public MergeEngine(MergeOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public MergeOptions options() {
        return options;
    }

    /**
     * Checks whether {@code other} can be merged into {@code target}.
     */
    public MergeCheck canMerge(Record target, Record other) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(other, "other");
        if (target == other || (target.isAttached() && target.identity() != null
                && target.toString().equals(other.toString()))) {
            return MergeCheck.rejected(CannotMergeException.REASON_SAME_RECORD, "Cannot merge identical records " + target);
        }
        GeoSequence mine = target.geo();
        GeoSequence theirs = other.geo();
        if (theirs.pointCount() == 0 && !theirs.waypoints().isEmpty()) {
            return MergeCheck.at(0, true);
        }
        int digits = options.getPositionDigits();
        if (options.isPartialTracks()) {
            int otherInSelf = mine.indexOf(theirs, digits);
            if (otherInSelf >= 0) {
                return MergeCheck.at(otherInSelf, true);
            }
            int selfInOther = theirs.indexOf(mine, digits);
            if (selfInOther >= 0) {
                return MergeCheck.at(selfInOther, false);
            }
        } else if (mine.pointsEqual(theirs, digits)) {
            return MergeCheck.at(0, true);
        }
        return MergeCheck.rejected(
                CannotMergeException.REASON_GEOMETRY_MISMATCH,
                "Cannot merge " + other + " with " + theirs.pointCount() + " points into "
                        + target + " with " + mine.pointCount() + " points");
    }

    /**
     * Merges {@code other} into {@code target}.
     *
     * @return messages describing every change, identical in dry-run mode.
     * @throws CannotMergeException if {@link #canMerge} rejects the pair.
     */
    public List<String> merge(Record target, Record other) {
        MergeCheck check = canMerge(target, other);
        if (!check.isMergeable()) {
            throw new CannotMergeException(check.getReasonCode(), check.getReason());
        }
        // names are taken before any change so a dry run reports the same text
        String otherSummary = other.summary();
        String targetSummary = target.summary();
        String otherName = other.toString();
        String targetName = target.toString();
        // an unattached record has nothing to remove from
        boolean removing = options.isRemove() && other.isAttached();
        List<String> changes = new ArrayList<>();
        try (SyncScope ignored = target.batchChanges()) {
            changes.addAll(mergeGeometry(target, other, check, targetName, otherName));
            changes.addAll(mergeWaypoints(target, other, targetName, otherName));
            changes.addAll(mergeMetadata(target, other, targetName, otherName));
        }
        List<String> result = new ArrayList<>();
        if (!changes.isEmpty()) {
            String andRemove = removing ? " and remove" : "";
            result.add("merge" + andRemove + " " + otherSummary);
            result.add(" ".repeat(andRemove.length()) + "  into " + targetSummary);
            for (String change : changes) {
                result.add(INDENT + change);
            }
        }
        if (removing) {
            if (changes.isEmpty()) {
                result.add("removed exact duplicate " + otherSummary + ": it was identical with " + targetSummary);
            }
            if (!options.isDryRun()) {
                other.remove();
            }
        }
        log.debug("merged {} into {}: {} changes", other, target, changes.size());
        return result;
    }

    private List<String> mergeGeometry(
            Record target, Record other, MergeCheck check, String targetName, String otherName) {
        List<String> messages = new ArrayList<>();
        GeoSequence theirs = other.geo();
        Duration offset = target.geo().timeOffset(theirs);
        if (offset != null) {
            messages.add("Time offset: " + TimeFormats.duration(offset));
        }
        if (theirs.pointCount() > target.geo().pointCount()) {
            if (!options.isDryRun()) {
                target.editGeometry(sequence -> sequence.replaceSegmentsWith(theirs));
            }
            messages.add(targetName + " got all segments from " + otherName);
            // the target now carries the other points and times as they are
            return messages;
        }
        int selfStart = check.isOtherInSelf() ? check.getOffset() : 0;
        int otherStart = check.isOtherInSelf() ? 0 : check.getOffset();
        List<GeoPoint> mine = target.geo().points();
        List<GeoPoint> source = theirs.points();
        List<int[]> fills = new ArrayList<>();
        for (int i = 0; selfStart + i < mine.size() && otherStart + i < source.size(); i++) {
            if (mine.get(selfStart + i).time() == null && source.get(otherStart + i).time() != null) {
                fills.add(new int[]{selfStart + i, otherStart + i});
            }
        }
        if (!fills.isEmpty()) {
            if (!options.isDryRun()) {
                target.editGeometry(sequence -> {
                    for (int[] fill : fills) {
                        Instant time = source.get(fill[1]).time();
                        sequence.setPoint(fill[0], mine.get(fill[0]).withTime(time));
                    }
                });
            }
            messages.add("Copied times for " + fills.size() + " out of " + mine.size() + " points");
        }
        return messages;
    }

    private List<String> mergeWaypoints(Record target, Record other, String targetName, String otherName) {
        Set<Long> known = new LinkedHashSet<>();
        for (Waypoint waypoint : target.geo().waypoints()) {
            known.add(waypoint.getPosition().positionKey());
        }
        List<Waypoint> added = new ArrayList<>();
        for (Waypoint waypoint : other.geo().waypoints()) {
            if (known.add(waypoint.getPosition().positionKey())) {
                added.add(waypoint);
            }
        }
        if (added.isEmpty()) {
            return List.of();
        }
        if (!options.isDryRun()) {
            target.editGeometry(sequence -> added.forEach(sequence::addWaypoint));
        }
        return List.of(targetName + " got " + added.size() + " waypoints from " + otherName);
    }

    private List<String> mergeMetadata(Record target, Record other, String targetName, String otherName) {
        List<String> messages = new ArrayList<>();
        boolean dryRun = options.isDryRun();
        if (takesTitleFrom(target, other)) {
            messages.add("Title: " + target.title() + " -> " + other.title());
            if (!dryRun) {
                target.setTitle(other.title());
            }
        }
        String description = other.description();
        if (!description.isEmpty() && !description.equals(target.description())) {
            messages.add("Additional description: " + description);
            if (!dryRun) {
                target.setDescription(target.description() + "\n" + description);
            }
        }
        if (other.isVisible() && !target.isVisible()) {
            messages.add("Visibility: private -> public");
            if (!dryRun) {
                target.setVisible(true);
            }
        }
        if (other.category() != target.category()) {
            messages.add("Category: " + otherName + "=" + other.category() + " differs, keeping "
                    + targetName + "=" + target.category());
        }
        TreeSet<String> newTags = new TreeSet<>(other.tags());
        newTags.removeAll(target.tags());
        if (!newTags.isEmpty()) {
            messages.add("New keywords: " + String.join(",", newTags));
            if (!dryRun) {
                target.addTags(newTags);
            }
        }
        List<String> united = new ArrayList<>(target.crossIds());
        united.addAll(other.crossIds());
        List<String> cleaned = CrossIds.clean(united);
        if (!cleaned.equals(target.crossIds())) {
            TreeSet<String> fresh = new TreeSet<>(cleaned);
            fresh.removeAll(target.crossIds());
            messages.add("New Ids: " + String.join(",", fresh));
            if (!dryRun) {
                target.setCrossIds(cleaned);
            }
        }
        return messages;
    }

    private static boolean takesTitleFrom(Record target, Record other) {
        String theirs = other.title();
        if (theirs.isEmpty() || theirs.equals(target.title())) {
            return false;
        }
        if (target.title().isEmpty()) {
            return true;
        }
        return hasDefaultTitle(target) && !hasDefaultTitle(other);
    }

    /**
     * True for an empty title, {@code "<category> track"}, or a title made only of digits
     * and date punctuation.
     */
    static boolean hasDefaultTitle(Record record) {
        String title = record.title();
        if (title.isEmpty()) {
            return true;
        }
        if (title.equals(record.category().displayName() + " track")) {
            return true;
        }
        for (int i = 0; i < title.length(); i++) {
            if (DEFAULT_TITLE_CHARS.indexOf(title.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }
}
