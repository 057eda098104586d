package org.Aayush.tracksync.collection;

import org.Aayush.tracksync.codec.Category;
import org.Aayush.tracksync.core.SyncScope;
import org.Aayush.tracksync.record.Record;
import org.Aayush.tracksync.testutil.TrackFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("In-Memory Collection Tests")
class InMemoryCollectionTest {

    private static Record ride(String title) {
        Record record = TrackFixtures.record(20);
        try (SyncScope ignored = record.batchChanges()) {
            record.setTitle(title);
            record.setCategory(Category.CYCLING);
            record.setVisible(true);
            record.setTags(List.of("berlin"));
        }
        return record;
    }

    @Test
    @DisplayName("Adding stores the record under an identity derived from its title")
    void testAddDerivesIdentity() {
        InMemoryCollection collection = new InMemoryCollection("scratch");

        Record first = collection.add(ride("Morning ride"));
        Record second = collection.add(ride("Morning ride"));
        Record untitled = collection.add(TrackFixtures.record(3));

        assertEquals("Morning ride", first.identity());
        assertEquals("Morning ride.1", second.identity());
        assertEquals("track", untitled.identity());
        assertEquals(3, collection.size());
        assertEquals("memory:scratch/Morning ride", first.toString());
        assertTrue(collection.storedText("Morning ride").contains("<keywords>berlin, Category:Cycling, Status:public</keywords>"));
    }

    @Test
    @DisplayName("Adding an already hosted record returns it unchanged")
    void testAddHostedRecord() {
        InMemoryCollection collection = new InMemoryCollection("scratch");
        Record record = collection.add(ride("a"));

        assertSame(record, collection.add(record));
        assertEquals(1, collection.size());
    }

    @Test
    @DisplayName("A record hosted elsewhere is copied and remembers its origin")
    void testAddFromOtherCollection() {
        InMemoryCollection source = new InMemoryCollection("source");
        InMemoryCollection target = new InMemoryCollection("target");
        Record original = source.add(ride("lake"));

        Record copy = target.add(original);

        assertNotSame(original, copy);
        assertSame(source, original.host());
        assertSame(target, copy.host());
        assertEquals(List.of("memory:source/lake"), copy.crossIds());
        assertTrue(target.storedText("lake").contains("Id:memory:source/lake"));
    }

    @Test
    @DisplayName("A fresh listing returns header records that load on demand")
    void testListingIsLazy() {
        InMemoryCollection collection = new InMemoryCollection("scratch");
        collection.add(ride("Morning ride"));
        collection.scan();

        Record listed = collection.records().get(0);

        assertFalse(listed.isLoaded());
        assertEquals("Morning ride", listed.title());
        assertEquals(Category.CYCLING, listed.category());
        assertTrue(listed.isVisible());
        assertEquals(TrackFixtures.START, listed.firstTime());
        assertTrue(listed.distanceKm() > 1.0d);
        assertFalse(listed.isLoaded());

        assertEquals(List.of("berlin"), listed.tags());
        assertTrue(listed.isLoaded());
        assertEquals(20, listed.pointCount());
    }

    @Test
    @DisplayName("Field writes change only the stored field")
    void testFieldWrite() {
        InMemoryCollection collection = new InMemoryCollection("scratch");
        collection.add(ride("Morning ride"));
        collection.scan();
        Record listed = collection.find("Morning ride");

        listed.setTitle("Evening ride");
        listed.addTags(List.of("spree"));

        String stored = collection.storedText("Morning ride");
        assertTrue(stored.contains("<name>Evening ride</name>"), stored);
        assertTrue(stored.contains("<keywords>berlin, spree, Category:Cycling, Status:public</keywords>"), stored);
    }

    @Test
    @DisplayName("Without field writes every change is a full write")
    void testFullWritesOnly() {
        CollectionConfig config = CollectionConfig.builder()
                .url("memory:full")
                .option(InMemoryCollection.OPTION_FIELD_WRITES, "false")
                .build();
        InMemoryCollection collection = new InMemoryCollection(config);
        Record record = collection.add(ride("a"));

        assertFalse(collection.supports(Capability.WRITE_TITLE));
        record.setDescription("written in full");

        assertTrue(collection.storedText("a").contains("<desc>written in full</desc>"));
        assertTrue(collection.storedText("a").contains("Status:public"));
    }

    @Test
    @DisplayName("Renaming moves the stored text and avoids collisions")
    void testRename() {
        InMemoryCollection collection = new InMemoryCollection("scratch");
        Record a = collection.add(ride("a"));
        collection.add(ride("b"));

        a.setIdentity("c");
        assertEquals("c", a.identity());
        assertSame(a, collection.find("c"));

        a.setIdentity("b");
        assertEquals("b.1", a.identity());
        assertTrue(collection.storedText("b.1").contains("<name>a</name>"));
        StorageException missing = assertThrows(StorageException.class, () -> collection.storedText("a"));
        assertEquals(StorageException.REASON_UNKNOWN_IDENTITY, missing.reasonCode());
    }

    @Test
    @DisplayName("Removing deletes stored text and detaches the record")
    void testRemove() {
        InMemoryCollection collection = new InMemoryCollection("scratch");
        Record record = collection.add(ride("a"));
        collection.add(ride("b"));

        collection.remove(record);

        assertEquals(1, collection.size());
        assertNull(collection.find("a"));
        assertFalse(record.isAttached());
        assertThrows(StorageException.class, () -> collection.storedText("a"));
        assertThrows(IllegalArgumentException.class, () -> collection.remove(record));

        collection.clear();
        assertEquals(0, collection.size());
        collection.scan();
        assertEquals(0, collection.size());
    }

    @Test
    @DisplayName("Slashes in titles are replaced when deriving identities")
    void testIdentityFromTitleWithSlash() {
        InMemoryCollection collection = new InMemoryCollection("scratch");

        Record stored = collection.add(ride("a/b"));

        assertEquals("a_b", stored.identity());
    }

    @Test
    @DisplayName("A failed add leaves the record unattached")
    void testFailedAdd() {
        AbstractRecordCollection failing = new AbstractRecordCollection("failing:test") {
            @Override
            public Set<Capability> capabilities() {
                return EnumSet.of(Capability.WRITE_FULL);
            }

            @Override
            public String writeFull(Record record, String desiredIdentity) {
                throw new StorageException(StorageException.REASON_STORAGE_FAILURE, "disk full");
            }
        };
        Record record = ride("a");

        assertThrows(StorageException.class, () -> failing.add(record));

        assertFalse(record.isAttached());
        assertNull(record.identity());
        assertEquals(0, failing.size());
        assertEquals("a", record.title());
    }

    @Test
    @DisplayName("Adding needs the full write capability")
    void testAddWithoutWriteCapability() {
        AbstractRecordCollection readOnly = new AbstractRecordCollection("readonly:test") {
            @Override
            public Set<Capability> capabilities() {
                return EnumSet.of(Capability.LIST);
            }
        };

        UnsupportedCapabilityException failure =
                assertThrows(UnsupportedCapabilityException.class, () -> readOnly.add(ride("a")));

        assertSame(Capability.WRITE_FULL, failure.capability());
    }
}
