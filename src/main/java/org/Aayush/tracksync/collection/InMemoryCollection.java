package org.Aayush.tracksync.collection;

import org.Aayush.tracksync.codec.AttributeCodec;
import org.Aayush.tracksync.codec.TrackAttributes;
import org.Aayush.tracksync.gpx.GpxDocument;
import org.Aayush.tracksync.gpx.GpxReader;
import org.Aayush.tracksync.gpx.GpxWriter;
import org.Aayush.tracksync.record.Record;
import org.Aayush.tracksync.record.RecordField;
import org.Aayush.tracksync.record.RecordHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collection keeping each record as GPX text in memory.
 *
 * <p>Listings return header-only records carrying title, category, visibility, first
 * time and distance; everything else is read lazily. Field writes rewrite only the
 * affected part of the stored document and can be switched off with the option
 * {@code fieldWrites=false}, forcing full writes.</p>
 */
public final class InMemoryCollection extends AbstractRecordCollection {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCollection.class);

    public static final String OPTION_FIELD_WRITES = "fieldWrites";
    private static final String DEFAULT_IDENTITY = "track";

    private static final Set<Capability> FULL_ONLY = Collections.unmodifiableSet(EnumSet.of(
            Capability.LIST,
            Capability.READ_FULL,
            Capability.WRITE_FULL,
            Capability.REMOVE,
            Capability.RENAME));
    private static final Set<Capability> ALL = Collections.unmodifiableSet(EnumSet.allOf(Capability.class));

    private final Map<String, String> storedGpx = new LinkedHashMap<>();
    private final Set<Capability> capabilities;

    public InMemoryCollection(String name) {
        this(CollectionConfig.of(CollectionRegistry.SCHEME_MEMORY + ":" + name));
    }

    public InMemoryCollection(CollectionConfig config) {
        super(config.getUrl());
        boolean fieldWrites = Boolean.parseBoolean(config.option(OPTION_FIELD_WRITES, "true"));
        this.capabilities = fieldWrites ? ALL : FULL_ONLY;
    }

    @Override
    public Set<Capability> capabilities() {
        return capabilities;
    }

    /**
     * Stored GPX text for {@code identity}.
     *
     * @throws StorageException if nothing is stored under {@code identity}.
     */
    public String storedText(String identity) {
        String xml = storedGpx.get(identity);
        if (xml == null) {
            throw new StorageException(StorageException.REASON_UNKNOWN_IDENTITY, identifier() + ": no record " + identity);
        }
        return xml;
    }

    @Override
    public List<Record> list() {
        List<Record> result = new ArrayList<>(storedGpx.size());
        for (Map.Entry<String, String> entry : storedGpx.entrySet()) {
            GpxDocument document = GpxReader.read(entry.getValue());
            TrackAttributes attributes = AttributeCodec.decode(document.getKeywords());
            RecordHeader header = RecordHeader.builder()
                    .title(document.getTitle())
                    .category(attributes.getCategory())
                    .visible(attributes.isVisible())
                    .firstTime(document.getGeo().firstTime())
                    .distanceKm(document.getGeo().distanceKm())
                    .build();
            result.add(new Record(this, entry.getKey(), header));
        }
        return result;
    }

    @Override
    public void readFull(Record record) {
        GpxReader.read(storedText(record.identity())).applyTo(record);
    }

    @Override
    public String writeFull(Record record, String desiredIdentity) {
        String identity = desiredIdentity;
        if (identity == null || (!identity.equals(record.identity()) && storedGpx.containsKey(identity))) {
            identity = uniqueIdentity(identity == null ? proposedIdentity(record) : identity);
        }
        storedGpx.put(identity, GpxWriter.write(GpxDocument.from(record)));
        log.debug("{}: stored {} with {} points", identifier(), identity, record.geo().pointCount());
        return identity;
    }

    @Override
    public void writeField(Record record, RecordField field) {
        if (field.writeCapability() == null || !capabilities.contains(field.writeCapability())) {
            throw new UnsupportedCapabilityException(
                    field.writeCapability() == null ? Capability.WRITE_FULL : field.writeCapability(),
                    identifier() + ": writing " + field.markerName() + " needs a full write");
        }
        GpxDocument stored = GpxReader.read(storedText(record.identity()));
        GpxDocument.GpxDocumentBuilder updated = GpxDocument.builder()
                .title(stored.getTitle())
                .description(stored.getDescription())
                .keywords(stored.getKeywords())
                .geo(stored.getGeo());
        switch (field) {
            case TITLE -> updated.title(record.title());
            case DESCRIPTION -> updated.description(record.description());
            default -> updated.keywords(AttributeCodec.encode(record.attributes()));
        }
        storedGpx.put(record.identity(), GpxWriter.write(updated.build()));
    }

    @Override
    protected void removeStored(String identity) {
        if (storedGpx.remove(identity) == null) {
            throw new StorageException(StorageException.REASON_UNKNOWN_IDENTITY, identifier() + ": no record " + identity);
        }
    }

    @Override
    protected String renameStored(String oldIdentity, String newIdentity) {
        String xml = storedText(oldIdentity);
        String finalIdentity = uniqueIdentity(newIdentity);
        storedGpx.remove(oldIdentity);
        storedGpx.put(finalIdentity, xml);
        return finalIdentity;
    }

    private String uniqueIdentity(String base) {
        if (!storedGpx.containsKey(base)) {
            return base;
        }
        for (int suffix = 1; ; suffix++) {
            String candidate = base + "." + suffix;
            if (!storedGpx.containsKey(candidate)) {
                return candidate;
            }
        }
    }

    private static String proposedIdentity(Record record) {
        String title = record.title().strip().replace('/', '_');
        return title.isEmpty() ? DEFAULT_IDENTITY : title;
    }
}
