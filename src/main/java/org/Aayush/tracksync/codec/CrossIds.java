package org.Aayush.tracksync.codec;

import lombok.experimental.UtilityClass;
import org.Aayush.tracksync.core.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Rules for the newest-first list of identifiers a record is known by elsewhere.
 *
 * <p>An identifier has the form {@code <origin>/<identity>}, where the origin is the
 * collection url (everything before the last {@code /}). Identifiers without a slash
 * have no origin.</p>
 */
@UtilityClass
public class CrossIds {
    public static final int MAX_IDS = 5;

    private static final Logger log = LoggerFactory.getLogger(CrossIds.class);

    /**
     * Removes redundant and old identifiers.
     *
     * <ol>
     *     <li>exact duplicates collapse to their first (newest) occurrence</li>
     *     <li>for every origin only the newest identifier survives</li>
     *     <li>only the {@value #MAX_IDS} newest identifiers are kept</li>
     * </ol>
     *
     * @param original identifiers, newest first.
     * @return cleaned copy.
     */
    public static List<String> clean(List<String> original) {
        Objects.requireNonNull(original, "original");
        List<String> result = new ArrayList<>(Math.min(original.size(), MAX_IDS));
        Set<String> seenIds = new HashSet<>();
        Set<String> seenOrigins = new HashSet<>();
        for (String id : original) {
            if (id == null || !seenIds.add(id)) {
                continue;
            }
            String origin = origin(id);
            if (origin != null && !seenOrigins.add(origin)) {
                continue;
            }
            result.add(id);
            if (result.size() == MAX_IDS) {
                break;
            }
        }
        if (!result.equals(original)) {
            log.debug("cross ids cleaned: {} -> {}", original, result);
        }
        return List.copyOf(result);
    }

    /**
     * Returns the origin url of an identifier, or {@code null} if it has none.
     */
    public static String origin(String id) {
        int slash = id.lastIndexOf('/');
        if (slash <= 0) {
            return null;
        }
        return id.substring(0, slash);
    }

    /**
     * Builds an identifier from a collection identifier and a record identity.
     */
    public static String compose(String collectionIdentifier, String identity) {
        Objects.requireNonNull(collectionIdentifier, "collectionIdentifier");
        Objects.requireNonNull(identity, "identity");
        if (collectionIdentifier.endsWith("/")) {
            return collectionIdentifier + identity;
        }
        return collectionIdentifier + "/" + identity;
    }

    /**
     * Checks that {@code ids} already satisfies every invariant.
     *
     * @throws ValidationException if any identifier is malformed or the list is not clean.
     */
    public static void validate(List<String> ids) {
        if (ids == null) {
            throw new ValidationException(ValidationException.REASON_INVALID_CROSS_IDS, "cross ids cannot be null");
        }
        for (String id : ids) {
            if (id == null || id.isBlank()) {
                throw new ValidationException(
                        ValidationException.REASON_INVALID_CROSS_IDS, "cross id must be non-blank: " + ids);
            }
            if (id.indexOf(',') >= 0 || !id.equals(id.strip())) {
                throw new ValidationException(
                        ValidationException.REASON_INVALID_CROSS_IDS,
                        "cross id must not contain commas or surrounding whitespace: '" + id + "'");
            }
        }
        if (ids.size() > MAX_IDS) {
            throw new ValidationException(
                    ValidationException.REASON_INVALID_CROSS_IDS,
                    "at most " + MAX_IDS + " cross ids allowed, got " + ids.size());
        }
        List<String> cleaned = clean(ids);
        if (!cleaned.equals(ids)) {
            throw new ValidationException(
                    ValidationException.REASON_INVALID_CROSS_IDS,
                    "cross ids must be unique per id and per origin: " + ids);
        }
    }
}
