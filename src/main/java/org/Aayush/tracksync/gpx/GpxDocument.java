package org.Aayush.tracksync.gpx;

import lombok.Builder;
import lombok.Value;
import org.Aayush.tracksync.codec.AttributeCodec;
import org.Aayush.tracksync.codec.TrackAttributes;
import org.Aayush.tracksync.core.ValidationException;
import org.Aayush.tracksync.geo.GeoSequence;
import org.Aayush.tracksync.record.Record;

import java.util.Objects;

/**
 * Persisted shape of one record: name, description, keywords and geometry.
 *
 * <p>{@code keywords} is the codec-encoded tag string.</p>
 */
@Value
@Builder
public class GpxDocument {
    @Builder.Default
    String title = "";
    @Builder.Default
    String description = "";
    @Builder.Default
    String keywords = "";
    @Builder.Default
    GeoSequence geo = new GeoSequence();

    /**
     * Snapshot of a record for writing.
     *
     * <p>Call during {@link org.Aayush.tracksync.collection.RecordCollection#writeFull}
     * so the keywords carry the encoded attributes.</p>
     */
    public static GpxDocument from(Record record) {
        Objects.requireNonNull(record, "record");
        return GpxDocument.builder()
                .title(record.title())
                .description(record.description())
                .keywords(record.rawTags())
                .geo(record.geo().copy())
                .build();
    }

    /**
     * Populates {@code record} with this content.
     *
     * @throws ValidationException if the record is not decoupled.
     */
    public void applyTo(Record record) {
        Objects.requireNonNull(record, "record");
        if (!record.isDecoupled()) {
            throw new ValidationException(
                    ValidationException.REASON_NOT_DECOUPLED, "populating " + record + " requires decoupled mode");
        }
        TrackAttributes attributes = AttributeCodec.decode(keywords);
        record.setTitle(title);
        record.setDescription(description);
        record.setCategory(attributes.getCategory());
        record.setVisible(attributes.isVisible());
        record.setTags(attributes.getTags());
        record.setCrossIds(attributes.getCrossIds());
        record.replaceGeometry(geo);
    }
}
