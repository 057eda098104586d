package org.Aayush.tracksync.diff;

import org.Aayush.tracksync.codec.AttributeCodec;
import org.Aayush.tracksync.core.time.TimeFormats;
import org.Aayush.tracksync.geo.GeoPoint;
import org.Aayush.tracksync.record.Record;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Detailed comparison of two similar records.
 *
 * <p>Metadata is compared field by field. Points are aligned on latitude, longitude and
 * elevation; time is not part of the alignment key, so a clock shift shows up only as
 * {@link DifferenceKind#TIME_OFFSET}.</p>
 */
public final class RecordPair {
    private final Record left;
    private final Record right;
    private final boolean verbose;
    private final List<Opcode> opcodes;
    private final Map<DifferenceKind, List<String>> differences = new EnumMap<>(DifferenceKind.class);

    public RecordPair(Record left, Record right) {
        this(left, right, DiffConfig.defaults());
    }

    public RecordPair(Record left, Record right, DiffConfig config) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.verbose = Objects.requireNonNull(config, "config").isVerbose();
        compareMetadata();
        List<GeoPoint> leftPoints = left.points();
        List<GeoPoint> rightPoints = right.points();
        this.opcodes = List.copyOf(new SequenceAligner<>(alignmentKeys(leftPoints), alignmentKeys(rightPoints)).opcodes());
        comparePoints(leftPoints, rightPoints);
        Duration offset = left.timeOffset(right);
        if (offset != null) {
            add(DifferenceKind.TIME_OFFSET, "Time offset: " + TimeFormats.duration(offset));
        }
    }

    public Record left() {
        return left;
    }

    public Record right() {
        return right;
    }

    /**
     * Point alignment, covering both point lists.
     */
    public List<Opcode> opcodes() {
        return opcodes;
    }

    /**
     * Opcodes other than {@link Opcode.Tag#EQUAL}.
     */
    public List<Opcode> changes() {
        List<Opcode> result = new ArrayList<>();
        for (Opcode opcode : opcodes) {
            if (opcode.tag() != Opcode.Tag.EQUAL) {
                result.add(opcode);
            }
        }
        return result;
    }

    /**
     * Messages per difference kind, in kind order. Kinds without differences are absent.
     */
    public Map<DifferenceKind, List<String>> differences() {
        return Collections.unmodifiableMap(differences);
    }

    public List<String> differences(DifferenceKind kind) {
        return differences.getOrDefault(kind, List.of());
    }

    public boolean hasDifferences() {
        return !differences.isEmpty();
    }

    /**
     * Flags of all present kinds, for example {@code "TZ"}.
     */
    public String flags() {
        StringBuilder result = new StringBuilder();
        for (DifferenceKind kind : differences.keySet()) {
            result.append(kind.flag());
        }
        return result.toString();
    }

    private void compareMetadata() {
        compare(DifferenceKind.TITLE, left.title(), right.title());
        compare(DifferenceKind.DESCRIPTION, left.description(), right.description());
        compare(DifferenceKind.CATEGORY, left.category().displayName(), right.category().displayName());
        compare(DifferenceKind.KEYWORDS, AttributeCodec.joinTags(left.tags()), AttributeCodec.joinTags(right.tags()));
        compare(DifferenceKind.VISIBILITY, status(left.isVisible()), status(right.isVisible()));
    }

    private void compare(DifferenceKind kind, String leftValue, String rightValue) {
        if (!leftValue.equals(rightValue)) {
            add(kind, "\"" + leftValue + "\" <> \"" + rightValue + "\"");
        }
    }

    private static String status(boolean visible) {
        return visible ? AttributeCodec.STATUS_PUBLIC : AttributeCodec.STATUS_PRIVATE;
    }

    private void comparePoints(List<GeoPoint> leftPoints, List<GeoPoint> rightPoints) {
        for (Opcode opcode : opcodes) {
            switch (opcode.tag()) {
                case DELETE -> add(DifferenceKind.POSITIONS, "points between " + between(
                        leftPoints.get(opcode.leftStart()).time(),
                        leftPoints.get(opcode.leftEnd() - 1).time()) + " are missing on the right");
                case INSERT -> add(DifferenceKind.POSITIONS, "points between " + between(
                        rightPoints.get(opcode.rightStart()).time(),
                        rightPoints.get(opcode.rightEnd() - 1).time()) + " are missing on the left");
                case REPLACE -> compareReplaced(
                        leftPoints.subList(opcode.leftStart(), opcode.leftEnd()),
                        rightPoints.subList(opcode.rightStart(), opcode.rightEnd()));
                default -> {
                }
            }
        }
    }

    private void compareReplaced(List<GeoPoint> leftRun, List<GeoPoint> rightRun) {
        if (samePositions(leftRun, rightRun)) {
            Set<Duration> deltas = new HashSet<>();
            for (int i = 0; i < leftRun.size(); i++) {
                deltas.add(delta(leftRun.get(i).time(), rightRun.get(i).time()));
            }
            if (deltas.size() != 1) {
                add(DifferenceKind.TIME_OFFSET, "Points have different times");
                return;
            }
            Duration delta = deltas.iterator().next();
            // equal positions and equal times: only the elevation differs
            if (delta != null && !delta.isZero()) {
                add(DifferenceKind.TIME_OFFSET, leftRun.size() + " points between "
                        + between(leftRun.get(0).time(), leftRun.get(leftRun.size() - 1).time())
                        + " on the left are " + TimeFormats.duration(delta) + " later on the right");
            }
            return;
        }
        Instant from = earliest(leftRun.get(0).time(), rightRun.get(0).time());
        Instant to = latest(leftRun.get(leftRun.size() - 1).time(), rightRun.get(rightRun.size() - 1).time());
        add(DifferenceKind.POSITIONS, "points between " + between(from, to) + " are different");
        if (verbose) {
            for (int i = 0; i < Math.min(leftRun.size(), rightRun.size()); i++) {
                add(DifferenceKind.POSITIONS, describe('<', leftRun.get(i)));
                add(DifferenceKind.POSITIONS, describe('>', rightRun.get(i)));
            }
        }
    }

    private static boolean samePositions(List<GeoPoint> leftRun, List<GeoPoint> rightRun) {
        if (leftRun.size() != rightRun.size()) {
            return false;
        }
        for (int i = 0; i < leftRun.size(); i++) {
            GeoPoint a = leftRun.get(i);
            GeoPoint b = rightRun.get(i);
            if (a.latitude() != b.latitude() || a.longitude() != b.longitude()) {
                return false;
            }
        }
        return true;
    }

    private static Duration delta(Instant from, Instant to) {
        if (from == null || to == null) {
            return null;
        }
        return Duration.between(from, to);
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null || b == null) {
            return a == null ? b : a;
        }
        return a.isBefore(b) ? a : b;
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null || b == null) {
            return a == null ? b : a;
        }
        return a.isAfter(b) ? a : b;
    }

    private static String between(Instant from, Instant to) {
        String[] rendered = TimeFormats.pair(from, to);
        return rendered[0] + " and " + rendered[1];
    }

    private static String describe(char sign, GeoPoint point) {
        return String.format(Locale.ROOT, "  %c %10.6f %11.6f %7.2f %s",
                sign, point.latitude(), point.longitude(),
                point.elevation() == null ? 0.0d : point.elevation(),
                TimeFormats.instant(point.time()));
    }

    private void add(DifferenceKind kind, String message) {
        differences.computeIfAbsent(kind, key -> new ArrayList<>()).add(message);
    }

    private static List<AlignmentKey> alignmentKeys(List<GeoPoint> points) {
        List<AlignmentKey> result = new ArrayList<>(points.size());
        for (GeoPoint point : points) {
            result.add(new AlignmentKey(
                    point.latitude(), point.longitude(), point.elevation() == null ? 0.0d : point.elevation()));
        }
        return result;
    }

    private record AlignmentKey(double latitude, double longitude, double elevation) {
    }

    @Override
    public String toString() {
        return "RecordPair(" + left + " <> " + right + ", " + flags() + ")";
    }
}
