package org.Aayush.tracksync.merge;

import org.Aayush.tracksync.collection.InMemoryCollection;
import org.Aayush.tracksync.diff.RecordSource;
import org.Aayush.tracksync.record.Record;
import org.Aayush.tracksync.testutil.TrackFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Collection Merge Tests")
class CollectionMergerTest {
    private InMemoryCollection target;
    private Record ride;

    private static Record at(double latitude, String title) {
        Record record = TrackFixtures.record(TrackFixtures.points(50, latitude, TrackFixtures.START, TrackFixtures.TIME_STEP));
        record.setTitle(title);
        return record;
    }

    @BeforeEach
    void setUp() {
        target = new InMemoryCollection("target");
        ride = target.add(at(52.5d, ""));
    }

    @Test
    @DisplayName("Unknown records are copied, known ones are merged")
    void testCopyAndMerge() {
        Record lake = at(40.0d, "Lake");
        Record named = at(52.5d, "Spree loop");

        List<String> messages = new CollectionMerger(MergeOptions.defaults())
                .merge(target, RecordSource.ofRecords(List.of(lake, named)));

        assertTrue(messages.get(0).startsWith("copy unsaved: \"Lake\""), messages.get(0));
        assertTrue(messages.get(0).endsWith(" -> memory:target/Lake"), messages.get(0));
        assertTrue(messages.contains("     Title:  -> Spree loop"), messages.toString());
        assertEquals(2, target.size());
        assertEquals("Spree loop", ride.title());
    }

    @Test
    @DisplayName("Moving removes records from their source collection")
    void testMove() {
        InMemoryCollection source = new InMemoryCollection("source");
        source.add(at(40.0d, "Lake"));
        source.add(at(52.5d, "Spree loop"));

        List<String> messages = new CollectionMerger(MergeOptions.builder().remove(true).build())
                .merge(target, RecordSource.of(source));

        assertEquals("move memory:source/Lake -> memory:target/Lake", messages.get(0));
        assertTrue(messages.get(1).startsWith("merge and remove memory:source/Spree loop("), messages.get(1));
        assertEquals(0, source.size());
        assertEquals(2, target.size());
        assertEquals(List.of("memory:source/Lake"), target.find("Lake").crossIds());
        assertEquals("Spree loop", ride.title());
    }

    @Test
    @DisplayName("Unattached records are merged but not removed")
    void testRemoveKeepsUnattached() {
        Record named = at(52.5d, "Spree loop");

        List<String> messages = new CollectionMerger(MergeOptions.builder().remove(true).build())
                .merge(target, RecordSource.of(named));

        assertTrue(messages.get(0).startsWith("merge unsaved: "), messages.get(0));
        assertFalse(named.isAttached());
        assertEquals(1, target.size());
    }

    @Test
    @DisplayName("Copy mode skips matching")
    void testCopyMode() {
        List<String> messages = new CollectionMerger(MergeOptions.builder().copy(true).build())
                .merge(target, RecordSource.of(at(52.5d, "Spree loop")));

        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("copy "), messages.get(0));
        assertEquals(2, target.size());
        assertEquals("", ride.title());
    }

    @Test
    @DisplayName("Duplicates inside the target are merged into the first one")
    void testDuplicatesInTarget() {
        target.add(at(52.5d, ""));

        List<String> messages = new CollectionMerger(MergeOptions.builder().remove(true).build())
                .merge(target, RecordSource.of(target));

        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("removed exact duplicate memory:target/track.1("), messages.get(0));
        assertEquals(List.of(ride), target.records());
    }

    @Test
    @DisplayName("A dry run reports copies and merges without changing the target")
    void testDryRun() {
        Record lake = at(40.0d, "Lake");
        Record named = at(52.5d, "Spree loop");

        List<String> messages = new CollectionMerger(MergeOptions.builder().dryRun(true).build())
                .merge(target, RecordSource.ofRecords(List.of(lake, named)));

        assertTrue(messages.get(0).endsWith(" -> memory:target"), messages.get(0));
        assertTrue(messages.contains("     Title:  -> Spree loop"), messages.toString());
        assertEquals(1, target.size());
        assertEquals("", ride.title());
        assertFalse(lake.isAttached());
    }
}
