package org.Aayush.tracksync.merge;

import org.Aayush.tracksync.codec.Category;
import org.Aayush.tracksync.collection.InMemoryCollection;
import org.Aayush.tracksync.geo.GeoPoint;
import org.Aayush.tracksync.geo.Waypoint;
import org.Aayush.tracksync.gpx.GpxDocument;
import org.Aayush.tracksync.record.Record;
import org.Aayush.tracksync.testutil.RecordingCollection;
import org.Aayush.tracksync.testutil.TrackFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Record Merge Tests")
class MergeEngineTest {
    private final MergeEngine engine = new MergeEngine(MergeOptions.defaults());

    @Test
    @DisplayName("An empty title takes the other title, even a date-like one")
    void testEmptyTitleTakesOther() {
        Record target = TrackFixtures.record(100);
        Record other = TrackFixtures.record(100);
        other.setTitle("2024-01-01 07:56");

        List<String> messages = engine.merge(target, other);

        assertEquals("2024-01-01 07:56", target.title());
        assertTrue(messages.contains("     Title:  -> 2024-01-01 07:56"), messages.toString());
        assertTrue(messages.get(0).startsWith("merge unsaved: "), messages.get(0));
        assertTrue(messages.get(1).startsWith("  into unsaved: "), messages.get(1));
    }

    @Test
    @DisplayName("A meaningful title is kept, a default one is replaced")
    void testTitlePolicy() {
        Record named = TrackFixtures.record(100);
        named.setTitle("Spree loop");
        Record dated = TrackFixtures.record(100);
        dated.setTitle("2024-01-01");

        engine.merge(named, dated);
        assertEquals("Spree loop", named.title());

        engine.merge(dated, named);
        assertEquals("Spree loop", dated.title());

        Record categoryTitle = TrackFixtures.record(10);
        categoryTitle.setCategory(Category.CYCLING);
        categoryTitle.setTitle("Cycling track");
        assertTrue(MergeEngine.hasDefaultTitle(categoryTitle));
        assertFalse(MergeEngine.hasDefaultTitle(named));
    }

    @Test
    @DisplayName("Metadata is united and every change is reported")
    void testMetadata() {
        Record target = TrackFixtures.record(100);
        target.setTitle("Spree loop");
        target.setDescription("windy");
        target.setCategory(Category.CYCLING);
        target.setTags(List.of("berlin"));
        Record other = TrackFixtures.record(100);
        other.setDescription("sunny");
        other.setVisible(true);
        other.setCategory(Category.RUNNING);
        other.setTags(List.of("spree", "berlin"));
        other.setCrossIds(List.of("memory:old/7"));

        List<String> messages = engine.merge(target, other);

        assertEquals("windy\nsunny", target.description());
        assertTrue(target.isVisible());
        assertEquals(Category.CYCLING, target.category());
        assertEquals(List.of("berlin", "spree"), target.tags());
        assertEquals(List.of("memory:old/7"), target.crossIds());
        assertTrue(messages.contains("     Additional description: sunny"), messages.toString());
        assertTrue(messages.contains("     Visibility: private -> public"), messages.toString());
        assertTrue(messages.contains("     New keywords: spree"), messages.toString());
        assertTrue(messages.contains("     New Ids: memory:old/7"), messages.toString());
        assertTrue(messages.stream().anyMatch(message -> message.startsWith("     Category: ")
                && message.contains("differs, keeping")), messages.toString());
    }

    @Test
    @DisplayName("Records with other geometry cannot be merged")
    void testGeometryMismatch() {
        Record target = TrackFixtures.record(100);
        Record other = TrackFixtures.record(TrackFixtures.points(100, 10.0d, TrackFixtures.START, TrackFixtures.TIME_STEP));

        MergeCheck check = engine.canMerge(target, other);
        CannotMergeException failure = assertThrows(CannotMergeException.class, () -> engine.merge(target, other));

        assertFalse(check.isMergeable());
        assertEquals(CannotMergeException.REASON_GEOMETRY_MISMATCH, failure.reasonCode());
    }

    @Test
    @DisplayName("A record cannot be merged into itself")
    void testSameRecord() {
        Record record = TrackFixtures.record(10);

        CannotMergeException failure = assertThrows(CannotMergeException.class, () -> engine.merge(record, record));

        assertEquals(CannotMergeException.REASON_SAME_RECORD, failure.reasonCode());
    }

    @Test
    @DisplayName("A dry run reports changes without applying them")
    void testDryRun() {
        MergeEngine dryRun = new MergeEngine(MergeOptions.builder().dryRun(true).remove(true).build());
        InMemoryCollection collection = new InMemoryCollection("dry");
        Record target = collection.add(TrackFixtures.record(100));
        Record other = TrackFixtures.record(100);
        other.setTitle("Spree loop");
        other.addWaypoint(Waypoint.of(GeoPoint.of(52.5d, 13.45d), "Cafe"));
        other = collection.add(other);

        List<String> messages = dryRun.merge(target, other);

        assertTrue(messages.get(0).startsWith("merge and remove "), messages.get(0));
        assertTrue(messages.contains("     Title:  -> Spree loop"), messages.toString());
        assertEquals("", target.title());
        assertTrue(target.waypoints().isEmpty());
        assertTrue(other.isAttached());
        assertEquals(2, collection.size());
    }

    @Test
    @DisplayName("An exact duplicate is removed with a single message")
    void testRemoveExactDuplicate() {
        MergeEngine removing = new MergeEngine(MergeOptions.builder().remove(true).build());
        InMemoryCollection collection = new InMemoryCollection("dupes");
        Record first = TrackFixtures.record(100);
        first.setTitle("Ride");
        Record second = TrackFixtures.record(100);
        second.setTitle("Ride");
        Record target = collection.add(first);
        Record duplicate = collection.add(second);

        List<String> messages = removing.merge(target, duplicate);

        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("removed exact duplicate memory:dupes/Ride.1("), messages.get(0));
        assertEquals(1, collection.size());
        assertFalse(duplicate.isAttached());
    }

    @Test
    @DisplayName("A record with only waypoints merges them into any track")
    void testWaypointsOnly() {
        Record target = TrackFixtures.record(100);
        Record other = new Record();
        other.addWaypoint(Waypoint.of(GeoPoint.of(52.5d, 13.45d), "Cafe"));
        other.addWaypoint(Waypoint.of(GeoPoint.of(52.5d, 13.46d), "Bridge"));

        List<String> messages = engine.merge(target, other);
        engine.merge(target, other);

        assertEquals(2, target.waypoints().size());
        assertTrue(messages.stream().anyMatch(message -> message.endsWith("got 2 waypoints from " + other)),
                messages.toString());
        assertEquals(100, target.pointCount());
    }

    @Test
    @DisplayName("Partial tracks merge only when allowed, the longer geometry wins")
    void testPartialTracks() {
        List<GeoPoint> points = northbound(60);
        Record target = TrackFixtures.record(points.subList(20, 40));
        Record other = TrackFixtures.record(points);

        assertFalse(engine.canMerge(target, other).isMergeable());

        MergeEngine partial = new MergeEngine(MergeOptions.builder().partialTracks(true).build());
        MergeCheck check = partial.canMerge(target, other);
        assertTrue(check.isMergeable());
        assertFalse(check.isOtherInSelf());
        assertEquals(20, check.getOffset());

        MergeCheck reverse = partial.canMerge(other, target);
        assertTrue(reverse.isOtherInSelf());
        assertEquals(20, reverse.getOffset());

        List<String> messages = partial.merge(target, other);
        assertEquals(60, target.pointCount());
        assertTrue(messages.stream().anyMatch(message -> message.contains("got all segments from")), messages.toString());
    }

    @Test
    @DisplayName("Taking the longer geometry keeps its own times at every position")
    void testPartialMergeKeepsOtherTimes() {
        List<GeoPoint> points = northbound(60);
        List<GeoPoint> longer = new ArrayList<>(points);
        for (int i = 0; i < 5; i++) {
            longer.set(i, points.get(i).withTime(null));
        }
        Record target = TrackFixtures.record(points.subList(20, 40));
        Record other = TrackFixtures.record(longer);
        MergeEngine partial = new MergeEngine(MergeOptions.builder().partialTracks(true).build());

        List<String> messages = partial.merge(target, other);

        assertEquals(60, target.pointCount());
        for (int i = 0; i < 5; i++) {
            assertNull(target.points().get(i).time(), "point " + i);
        }
        assertEquals(TrackFixtures.START.plusSeconds(200), target.points().get(20).time());
        assertFalse(messages.stream().anyMatch(message -> message.contains("Copied times")), messages.toString());
    }

    @Test
    @DisplayName("A dry run reports exactly what the real merge reports")
    void testDryRunMatchesRealRun() {
        List<GeoPoint> points = northbound(60);
        List<GeoPoint> untimed = new ArrayList<>();
        for (GeoPoint point : points.subList(20, 40)) {
            untimed.add(point.withTime(null));
        }
        Record other = TrackFixtures.record(points);
        other.setTitle("Spree loop");
        other.setCategory(Category.RUNNING);
        Record dryTarget = TrackFixtures.record(untimed);
        Record realTarget = TrackFixtures.record(untimed);
        MergeOptions options = MergeOptions.builder().partialTracks(true).build();

        List<String> dry = new MergeEngine(options.toBuilder().dryRun(true).build()).merge(dryTarget, other);
        List<String> real = new MergeEngine(options).merge(realTarget, other);

        assertEquals(real, dry);
        assertFalse(dry.stream().anyMatch(message -> message.contains("Copied times")), dry.toString());
        assertEquals(20, dryTarget.pointCount());
        assertNull(dryTarget.firstTime());
        assertEquals(60, realTarget.pointCount());
        assertEquals("Spree loop", realTarget.title());
    }

    @Test
    @DisplayName("Records without times render a dash in merge messages")
    void testMissingTimeRendering() {
        List<GeoPoint> untimed = new ArrayList<>();
        for (GeoPoint point : TrackFixtures.points(10)) {
            untimed.add(point.withTime(null));
        }
        Record target = TrackFixtures.record(untimed);
        Record other = TrackFixtures.record(untimed);
        other.setTitle("Spree loop");

        List<String> messages = engine.merge(target, other);

        assertTrue(messages.get(0).startsWith("merge unsaved: \"Spree loop\" time=-("), messages.get(0));
        assertTrue(messages.get(1).startsWith("  into unsaved: \"untitled\" time=-("), messages.get(1));
        assertFalse(String.join("\n", messages).contains("None"), messages.toString());
    }

    @Test
    @DisplayName("Missing point times are copied from the other record")
    void testTimeBackfill() {
        List<GeoPoint> timed = TrackFixtures.points(50);
        List<GeoPoint> untimed = new ArrayList<>();
        for (GeoPoint point : timed) {
            untimed.add(point.withTime(null));
        }
        Record target = TrackFixtures.record(untimed);
        Record other = TrackFixtures.record(timed);
        assertNull(target.firstTime());

        List<String> messages = engine.merge(target, other);

        assertTrue(messages.contains("     Copied times for 50 out of 50 points"), messages.toString());
        assertEquals(TrackFixtures.START, target.firstTime());
        assertEquals(TrackFixtures.START.plusSeconds(490), target.lastTime());
    }

    @Test
    @DisplayName("A shifted clock is reported as time offset")
    void testTimeOffsetMessage() {
        List<GeoPoint> points = TrackFixtures.points(50);
        Record target = TrackFixtures.record(points);
        Record other = TrackFixtures.record(TrackFixtures.shifted(points, Duration.ofMinutes(-15)));

        List<String> messages = engine.merge(target, other);

        assertTrue(messages.contains("     Time offset: -0:15:00"), messages.toString());
    }

    @Test
    @DisplayName("A merge with many changes writes the target back once")
    void testSingleWriteBack() {
        RecordingCollection collection = RecordingCollection.fullWritesOnly();
        collection.seed("a", GpxDocument.builder().keywords("Category:Cycling, Status:private").geo(TrackFixtures.sequence(100)).build());
        Record target = collection.listed("a");
        Record other = TrackFixtures.record(100);
        other.setTitle("Spree loop");
        other.setDescription("sunny");
        other.setVisible(true);
        other.setTags(List.of("spree"));
        other.addWaypoint(Waypoint.of(GeoPoint.of(52.5d, 13.45d), "Cafe"));

        engine.merge(target, other);

        assertEquals(List.of("readFull a", "writeFull a"), collection.calls());
        GpxDocument stored = collection.stored("a");
        assertEquals("Spree loop", stored.getTitle());
        assertEquals("spree, Category:Cycling, Status:public", stored.getKeywords());
        assertEquals(1, stored.getGeo().waypoints().size());
    }

    @Test
    @DisplayName("Nothing is written when the records already agree")
    void testNoChanges() {
        RecordingCollection collection = new RecordingCollection();
        collection.seed("a", GpxDocument.builder().geo(TrackFixtures.sequence(10)).build());
        Record target = collection.listed("a");

        List<String> messages = engine.merge(target, TrackFixtures.record(10));

        assertTrue(messages.isEmpty());
        assertEquals(0, collection.count("write"));
    }

    private static List<GeoPoint> northbound(int count) {
        List<GeoPoint> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(GeoPoint.of(TrackFixtures.START_LATITUDE + i * 0.01d, TrackFixtures.START_LONGITUDE,
                    TrackFixtures.START.plus(TrackFixtures.TIME_STEP.multipliedBy(i))));
        }
        return result;
    }
}
