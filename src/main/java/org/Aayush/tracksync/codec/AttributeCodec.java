package org.Aayush.tracksync.codec;

import lombok.experimental.UtilityClass;
import org.Aayush.tracksync.core.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Multiplexes category, visibility and cross ids into the single free-text tag list
 * used for storage, and demultiplexes on read.
 *
 * <p>Encoded form: plain tags first, then {@code Category:<name>}, then
 * {@code Status:public|private}, then one {@code Id:<id>} per cross id, joined with
 * {@code ", "}.</p>
 */
@UtilityClass
public class AttributeCodec {
    public static final String CATEGORY_PREFIX = "Category:";
    public static final String STATUS_PREFIX = "Status:";
    public static final String ID_PREFIX = "Id:";
    public static final String STATUS_PUBLIC = "public";
    public static final String STATUS_PRIVATE = "private";
    public static final char SEPARATOR = ',';
    public static final String JOINER = ", ";

    private static final String[] RESERVED_PREFIXES = {CATEGORY_PREFIX, STATUS_PREFIX, ID_PREFIX};

    /**
     * Encodes attributes into the persisted tag string.
     */
    public static String encode(TrackAttributes attributes) {
        Objects.requireNonNull(attributes, "attributes");
        List<String> parts = new ArrayList<>(attributes.getTags());
        parts.add(CATEGORY_PREFIX + attributes.getCategory().displayName());
        parts.add(STATUS_PREFIX + (attributes.isVisible() ? STATUS_PUBLIC : STATUS_PRIVATE));
        for (String id : attributes.getCrossIds()) {
            parts.add(ID_PREFIX + id);
        }
        return String.join(JOINER, parts);
    }

    /**
     * Decodes a persisted tag string.
     *
     * <p>Missing category or status fall back to their defaults. Plain tags come back
     * sorted and deduplicated; cross ids keep their order and are cleaned.</p>
     *
     * @throws DuplicateKeywordException if {@code Category:} or {@code Status:} appears twice.
     * @throws ValidationException for an unknown category or status value.
     */
    public static TrackAttributes decode(String raw) {
        if (raw == null || raw.isBlank()) {
            return TrackAttributes.defaults();
        }
        Category category = null;
        Boolean visible = null;
        List<String> crossIds = new ArrayList<>();
        TreeSet<String> tags = new TreeSet<>();
        for (String part : raw.split(String.valueOf(SEPARATOR))) {
            String entry = part.strip();
            if (entry.isEmpty()) {
                continue;
            }
            if (entry.startsWith(CATEGORY_PREFIX)) {
                if (category != null) {
                    throw new DuplicateKeywordException("Category appears more than once in '" + raw + "'");
                }
                category = Category.fromDisplayName(entry.substring(CATEGORY_PREFIX.length()).strip());
            } else if (entry.startsWith(STATUS_PREFIX)) {
                if (visible != null) {
                    throw new DuplicateKeywordException("Status appears more than once in '" + raw + "'");
                }
                visible = decodeStatus(entry.substring(STATUS_PREFIX.length()).strip());
            } else if (entry.startsWith(ID_PREFIX)) {
                String id = entry.substring(ID_PREFIX.length()).strip();
                if (!id.isEmpty()) {
                    crossIds.add(id);
                }
            } else {
                tags.add(entry);
            }
        }
        return TrackAttributes.builder()
                .category(category == null ? Category.defaultCategory() : category)
                .visible(visible != null && visible)
                .crossIds(CrossIds.clean(crossIds))
                .tags(List.copyOf(tags))
                .build();
    }

    /**
     * Joins plain tags the way they are persisted when no typed fields are encoded.
     */
    public static String joinTags(Collection<String> tags) {
        return String.join(JOINER, tags);
    }

    /**
     * Validates one plain tag.
     *
     * @throws ReservedKeywordException if it starts with a reserved prefix.
     * @throws ValidationException if it is blank or contains the separator.
     */
    public static void checkTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new ValidationException(ValidationException.REASON_INVALID_TAG, "tag must be non-blank");
        }
        // tags are stored stripped, so the prefix check must see the stripped value
        String stripped = tag.strip();
        for (String prefix : RESERVED_PREFIXES) {
            if (stripped.startsWith(prefix)) {
                throw new ReservedKeywordException(
                        "Do not use " + prefix + " directly in tags, use the typed setter: '" + tag + "'");
            }
        }
        if (tag.indexOf(SEPARATOR) >= 0) {
            throw new ValidationException(ValidationException.REASON_INVALID_TAG, "No comma allowed within a tag: '" + tag + "'");
        }
    }

    /**
     * Validates, strips and sorts tags for assignment.
     *
     * @param rejectDuplicates if true, a repeated tag is a {@link ValidationException}.
     * @return sorted, deduplicated tags.
     */
    public static List<String> normalizeTags(Collection<String> tags, boolean rejectDuplicates) {
        Objects.requireNonNull(tags, "tags");
        TreeSet<String> result = new TreeSet<>();
        for (String tag : tags) {
            checkTag(tag);
            String stripped = tag.strip();
            if (!result.add(stripped) && rejectDuplicates) {
                throw new ValidationException(ValidationException.REASON_DUPLICATE_TAG, "duplicate tag: '" + stripped + "'");
            }
        }
        return List.copyOf(result);
    }

    private static boolean decodeStatus(String value) {
        if (STATUS_PUBLIC.equals(value)) {
            return true;
        }
        if (STATUS_PRIVATE.equals(value)) {
            return false;
        }
        throw new ValidationException(
                ValidationException.REASON_INVALID_VISIBILITY, "Status must be public or private, got '" + value + "'");
    }
}
