package org.Aayush.tracksync.record;

import org.Aayush.tracksync.codec.AttributeCodec;
import org.Aayush.tracksync.codec.Category;
import org.Aayush.tracksync.codec.CrossIds;
import org.Aayush.tracksync.codec.TrackAttributes;
import org.Aayush.tracksync.collection.Capability;
import org.Aayush.tracksync.collection.RecordCollection;
import org.Aayush.tracksync.collection.UnsupportedCapabilityException;
import org.Aayush.tracksync.core.SyncScope;
import org.Aayush.tracksync.core.ValidationException;
import org.Aayush.tracksync.core.time.TimeFormats;
import org.Aayush.tracksync.geo.GeoDistance;
import org.Aayush.tracksync.geo.GeoPoint;
import org.Aayush.tracksync.geo.GeoSequence;
import org.Aayush.tracksync.geo.Waypoint;
import org.Aayush.tracksync.similarity.SimilarityEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.WeakHashMap;
import java.util.function.Consumer;

/**
 * One GPS track mirrored from a hosting collection.
 *
 * <p><b>States</b></p>
 * <ul>
 *   <li>Unattached: no host. Mutations only change memory.</li>
 *   <li>Attached, header only: created by a listing; reading a field missing from the
 *   header triggers a full load through {@link RecordCollection#readFull(Record)}.</li>
 *   <li>Attached, loaded: everything is in memory.</li>
 * </ul>
 *
 * <p>Orthogonal to those states, {@link #decouple()} opens a scope in which writes
 * and loads never reach the collection, and {@link #batchChanges()} defers write-back
 * to exactly one flush at scope exit. Both scopes nest with restore-previous
 * semantics.</p>
 *
 * <p>Getters may perform collection I/O when the record is not loaded yet. Call
 * {@link #loadFull()} to make that point explicit.</p>
 *
 * <p>This class is not thread-safe.</p>
 */
public final class Record {
    private static final Logger log = LoggerFactory.getLogger(Record.class);

    /** A jump farther than this starts a new segment in {@link #splitAtStops(Duration)}. */
    private static final double STOP_SPLIT_DISTANCE_METERS = 5_000.0d;
    private static final double SPEED_TOLERANCE = 1e-3d;

    private RecordCollection host;
    private String identity;
    private String title = "";
    private String description = "";
    private Category category = Category.defaultCategory();
    private boolean visible;
    private List<String> crossIds = List.of();
    private List<String> tags = List.of();
    private final GeoSequence geo;

    private boolean loaded;
    private RecordHeader header = RecordHeader.empty();
    private final LinkedHashSet<RecordField> dirty = new LinkedHashSet<>();
    private boolean decoupled;
    private boolean batch;
    private String rawTagsOverride;

    private Double cachedDistanceKm;
    private final Map<Record, Double> similarities = new WeakHashMap<>();

    /**
     * Creates an empty unattached record.
     */
    public Record() {
        this(new GeoSequence());
    }

    /**
     * Creates an unattached record owning a copy of {@code geo}.
     */
    public Record(GeoSequence geo) {
        this.geo = Objects.requireNonNull(geo, "geo").copy();
        this.loaded = true;
    }

    /**
     * Creates an attached, header-only record. Used by collection listings.
     *
     * @param host hosting collection.
     * @param identity identity within {@code host}.
     * @param header summary fields known without a full read.
     */
    public Record(RecordCollection host, String identity, RecordHeader header) {
        this.host = Objects.requireNonNull(host, "host");
        this.identity = checkIdentity(Objects.requireNonNull(identity, "identity"));
        this.header = Objects.requireNonNull(header, "header");
        this.geo = new GeoSequence();
        this.loaded = false;
    }

    // ------------------------------------------------------------------
    // Host and identity
    // ------------------------------------------------------------------

    public RecordCollection host() {
        return host;
    }

    public String identity() {
        return identity;
    }

    public boolean isAttached() {
        return host != null;
    }

    public boolean isLoaded() {
        return loaded;
    }

    /**
     * True inside a {@link #decouple()} scope, and always for an unattached record.
     */
    public boolean isDecoupled() {
        return decoupled || host == null;
    }

    public boolean isBatching() {
        return batch;
    }

    /**
     * Pending write markers in marking order.
     */
    public List<RecordField> dirty() {
        return List.copyOf(dirty);
    }

    /**
     * Attaches this record to {@code newHost}.
     *
     * <p>Moving an attached record to another host is only allowed while decoupled.</p>
     *
     * @throws IllegalIdentityChangeException if already attached elsewhere.
     */
    public void attach(RecordCollection newHost) {
        Objects.requireNonNull(newHost, "newHost");
        if (host == newHost) {
            return;
        }
        if (host != null && !decoupled) {
            throw new IllegalIdentityChangeException(
                    IllegalIdentityChangeException.REASON_HOST_CHANGE,
                    this + " is already hosted by " + host.identifier());
        }
        host = newHost;
    }

    /**
     * Drops host and identity. Only allowed while decoupled.
     */
    public void detach() {
        if (host != null && !decoupled) {
            throw new IllegalIdentityChangeException(
                    IllegalIdentityChangeException.REASON_HOST_CHANGE, "detach " + this + " requires decoupled mode");
        }
        host = null;
        identity = null;
        dirty.clear();
    }

    /**
     * Changes the identity.
     *
     * <ul>
     *   <li>Same value: no-op.</li>
     *   <li>Decoupled, or first identity: plain assignment.</li>
     *   <li>Otherwise the host renames the stored record.</li>
     * </ul>
     *
     * @throws IllegalIdentityChangeException if unattached, or when clearing a saved identity.
     */
    public void setIdentity(String value) {
        if (value != null) {
            checkIdentity(value);
        }
        if (host == null) {
            throw new IllegalIdentityChangeException(
                    IllegalIdentityChangeException.REASON_UNATTACHED,
                    "cannot set identity " + value + " on an unattached record");
        }
        if (Objects.equals(identity, value)) {
            return;
        }
        if (decoupled || identity == null) {
            identity = value;
            return;
        }
        if (value == null) {
            throw new IllegalIdentityChangeException(
                    IllegalIdentityChangeException.REASON_CLEAR_SAVED_IDENTITY,
                    "cannot clear identity of saved record " + this);
        }
        requireCapability(Capability.RENAME);
        log.debug("{}: renaming to {}", this, value);
        try (SyncScope ignored = decouple()) {
            host.rename(this, value);
        }
    }

    private static String checkIdentity(String value) {
        if (value.isBlank() || value.indexOf('/') >= 0) {
            throw new ValidationException(
                    ValidationException.REASON_INVALID_IDENTITY, "identity must be non-blank without '/': '" + value + "'");
        }
        return value;
    }

    /**
     * Deletes this record from its host and clears its identity.
     *
     * @throws UnsupportedCapabilityException if unattached or the host cannot remove.
     */
    public void remove() {
        if (host == null) {
            throw new UnsupportedCapabilityException(
                    UnsupportedCapabilityException.REASON_REMOVE_UNATTACHED, "cannot remove unattached record " + this);
        }
        if (identity != null) {
            requireCapability(Capability.REMOVE);
            host.remove(identity);
        }
        try (SyncScope ignored = decouple()) {
            detach();
        }
    }

    // ------------------------------------------------------------------
    // Scopes
    // ------------------------------------------------------------------

    /**
     * Opens a scope suppressing write-back and full loads.
     *
     * <p>Closing restores the previous mode, so scopes nest.</p>
     */
    public SyncScope decouple() {
        boolean previous = decoupled;
        decoupled = true;
        return () -> decoupled = previous;
    }

    /**
     * Opens a scope deferring write-back to its close.
     *
     * <p>The outermost close flushes once, also when the scope body threw.</p>
     */
    public SyncScope batchChanges() {
        boolean previous = batch;
        batch = true;
        return () -> {
            batch = previous;
            flush();
        };
    }

    // ------------------------------------------------------------------
    // Loading and write-back
    // ------------------------------------------------------------------

    /**
     * Reads the full record from the host.
     *
     * <p>No-op when loaded, unattached, without identity, decoupled, or when the host
     * cannot read full records.</p>
     */
    public void loadFull() {
        if (loaded || host == null || identity == null || decoupled) {
            return;
        }
        if (!host.supports(Capability.READ_FULL)) {
            return;
        }
        log.debug("{}: loading full record", this);
        try (SyncScope ignored = decouple()) {
            host.readFull(this);
        }
        loaded = true;
        header = RecordHeader.empty();
        invalidateGeometryCaches();
    }

    /**
     * Writes pending changes to the host.
     *
     * <p>Does nothing when nothing is dirty, while decoupled or inside a batch. An unsaved
     * record or a geometry change needs one full write, as does any field the host cannot
     * write alone; otherwise each dirty field is written on its own. A failing write
     * leaves the unwritten markers in place for the next attempt.</p>
     *
     * @throws UnsupportedCapabilityException if a full write is needed but unsupported.
     */
    public void flush() {
        if (host == null) {
            dirty.clear();
            return;
        }
        if (dirty.isEmpty() || decoupled || batch) {
            return;
        }
        boolean full = needsFullWrite();
        if (full) {
            requireCapability(Capability.WRITE_FULL);
        }
        try (SyncScope ignored = decouple()) {
            if (full) {
                writeFull();
            } else {
                for (RecordField field : new ArrayList<>(dirty)) {
                    log.debug("{}: writing {}", this, field.markerName());
                    host.writeField(this, field);
                    dirty.remove(field);
                }
            }
        }
    }

    private boolean needsFullWrite() {
        if (identity == null) {
            return true;
        }
        for (RecordField field : dirty) {
            Capability capability = field.writeCapability();
            if (capability == null || !host.supports(capability)) {
                return true;
            }
        }
        return false;
    }

    private void writeFull() {
        log.debug("{}: full write for {}", this, dirty);
        String previous = rawTagsOverride;
        rawTagsOverride = AttributeCodec.encode(attributes());
        String newIdentity;
        try {
            newIdentity = host.writeFull(this, identity);
        } finally {
            rawTagsOverride = previous;
        }
        if (newIdentity != null) {
            setIdentity(newIdentity);
        }
        dirty.clear();
    }

    /**
     * Flags the whole geometry as changed after direct edits on {@link #geo()}.
     */
    public void rewrite() {
        loadFull();
        markDirty(RecordField.GPX);
    }

    private void markDirty(RecordField field) {
        if (field == RecordField.GPX) {
            invalidateGeometryCaches();
        }
        header = header.without(field);
        if (isDecoupled()) {
            return;
        }
        dirty.add(field);
        if (!batch) {
            flush();
        }
    }

    private void requireCapability(Capability capability) {
        if (!host.supports(capability)) {
            throw new UnsupportedCapabilityException(
                    capability, host.identifier() + " does not support " + capability + " for " + this);
        }
    }

    // ------------------------------------------------------------------
    // Metadata
    // ------------------------------------------------------------------

    public String title() {
        if (!loaded && header.getTitle() != null) {
            return header.getTitle();
        }
        loadFull();
        return title;
    }

    public void setTitle(String value) {
        String newValue = value == null ? "" : value;
        loadFull();
        if (newValue.equals(title) && header.getTitle() == null) {
            return;
        }
        title = newValue;
        markDirty(RecordField.TITLE);
    }

    public String description() {
        if (!loaded && header.getDescription() != null) {
            return header.getDescription();
        }
        loadFull();
        return description;
    }

    public void setDescription(String value) {
        String newValue = value == null ? "" : value;
        loadFull();
        if (newValue.equals(description) && header.getDescription() == null) {
            return;
        }
        description = newValue;
        markDirty(RecordField.DESCRIPTION);
    }

    public Category category() {
        if (!loaded && header.getCategory() != null) {
            return header.getCategory();
        }
        loadFull();
        return category;
    }

    /**
     * @throws ValidationException for {@code null}.
     */
    public void setCategory(Category value) {
        if (value == null) {
            throw new ValidationException(ValidationException.REASON_INVALID_CATEGORY, "category must not be null");
        }
        loadFull();
        if (value == category && header.getCategory() == null) {
            return;
        }
        category = value;
        markDirty(RecordField.CATEGORY);
    }

    /**
     * Sets the category by display name.
     *
     * @throws ValidationException for an unknown name.
     */
    public void setCategory(String displayName) {
        setCategory(Category.fromDisplayName(displayName));
    }

    public boolean isVisible() {
        if (!loaded && header.getVisible() != null) {
            return header.getVisible();
        }
        loadFull();
        return visible;
    }

    /**
     * @throws ValidationException for {@code null}.
     */
    public void setVisible(Boolean value) {
        if (value == null) {
            throw new ValidationException(ValidationException.REASON_INVALID_VISIBILITY, "visibility must be true or false");
        }
        loadFull();
        if (value == visible && header.getVisible() == null) {
            return;
        }
        visible = value;
        markDirty(RecordField.VISIBILITY);
    }

    /**
     * Plain tags, sorted and without reserved entries.
     */
    public List<String> tags() {
        if (!loaded && header.getTags() != null) {
            return header.getTags();
        }
        loadFull();
        return tags;
    }

    /**
     * Replaces all plain tags.
     *
     * @throws ValidationException for blank, comma-carrying or duplicate tags.
     * @throws org.Aayush.tracksync.codec.ReservedKeywordException for reserved prefixes.
     */
    public void setTags(Collection<String> values) {
        List<String> normalized = AttributeCodec.normalizeTags(values, true);
        loadFull();
        if (normalized.equals(tags) && header.getTags() == null) {
            return;
        }
        tags = normalized;
        markDirty(RecordField.TAGS);
    }

    /**
     * Adds tags. Tags already present are ignored.
     */
    public void addTags(Collection<String> values) {
        List<String> normalized = AttributeCodec.normalizeTags(values, false);
        loadFull();
        TreeSet<String> union = new TreeSet<>(tags);
        if (!union.addAll(normalized)) {
            return;
        }
        tags = List.copyOf(union);
        markDirty(RecordField.TAGS);
    }

    /**
     * Removes tags. Tags not present are ignored.
     */
    public void removeTags(Collection<String> values) {
        Objects.requireNonNull(values, "values");
        loadFull();
        TreeSet<String> remaining = new TreeSet<>(tags);
        boolean changed = false;
        for (String value : values) {
            if (value != null) {
                changed |= remaining.remove(value.strip());
            }
        }
        if (!changed) {
            return;
        }
        tags = List.copyOf(remaining);
        markDirty(RecordField.TAGS);
    }

    /**
     * Known identities in other collections, newest first.
     */
    public List<String> crossIds() {
        if (!loaded && header.getCrossIds() != null) {
            return header.getCrossIds();
        }
        loadFull();
        return crossIds;
    }

    /**
     * @throws ValidationException if {@code values} is not already clean.
     */
    public void setCrossIds(List<String> values) {
        CrossIds.validate(values);
        List<String> newValue = List.copyOf(values);
        loadFull();
        if (newValue.equals(crossIds) && header.getCrossIds() == null) {
            return;
        }
        crossIds = newValue;
        markDirty(RecordField.CROSS_IDS);
    }

    /**
     * Typed attributes as held in memory, never loading.
     */
    public TrackAttributes attributes() {
        return TrackAttributes.builder()
                .category(category)
                .visible(visible)
                .crossIds(crossIds)
                .tags(tags)
                .build();
    }

    /**
     * Persisted tag string.
     *
     * <p>During a full write this is the codec-encoded form with category, status and
     * cross ids; otherwise only the plain tags joined.</p>
     */
    public String rawTags() {
        if (rawTagsOverride != null) {
            return rawTagsOverride;
        }
        return AttributeCodec.joinTags(tags);
    }

    // ------------------------------------------------------------------
    // Geometry
    // ------------------------------------------------------------------

    /**
     * Live geometry. Direct edits must be followed by {@link #rewrite()}.
     */
    public GeoSequence geo() {
        loadFull();
        return geo;
    }

    public Instant firstTime() {
        if (!loaded && header.getFirstTime() != null) {
            return header.getFirstTime();
        }
        loadFull();
        return geo.firstTime();
    }

    public Instant lastTime() {
        loadFull();
        return geo.lastTime();
    }

    public double distanceKm() {
        if (!loaded && header.getDistanceKm() != null) {
            return header.getDistanceKm();
        }
        loadFull();
        if (cachedDistanceKm == null) {
            cachedDistanceKm = geo.distanceKm();
        }
        return cachedDistanceKm;
    }

    public int pointCount() {
        loadFull();
        return geo.pointCount();
    }

    public double speedKmh() {
        loadFull();
        return geo.speedKmh();
    }

    public double movingSpeedKmh() {
        loadFull();
        return geo.movingSpeedKmh();
    }

    public List<GeoPoint> points() {
        loadFull();
        return geo.points();
    }

    public List<Waypoint> waypoints() {
        loadFull();
        return geo.waypoints();
    }

    /**
     * Appends points to the last segment.
     */
    public void addPoints(Collection<GeoPoint> points) {
        Objects.requireNonNull(points, "points");
        if (points.isEmpty()) {
            return;
        }
        editGeometry(sequence -> sequence.addPoints(points));
    }

    public void addWaypoint(Waypoint waypoint) {
        Objects.requireNonNull(waypoint, "waypoint");
        editGeometry(sequence -> sequence.addWaypoint(waypoint));
    }

    /**
     * Replaces the whole geometry with a copy of {@code other}.
     */
    public void replaceGeometry(GeoSequence other) {
        Objects.requireNonNull(other, "other");
        editGeometry(sequence -> sequence.replaceWith(other));
    }

    /**
     * Applies {@code editor} to the geometry and marks it for write-back once.
     */
    public void editGeometry(Consumer<GeoSequence> editor) {
        Objects.requireNonNull(editor, "editor");
        loadFull();
        editor.accept(geo);
        markDirty(RecordField.GPX);
    }

    /**
     * Moves all times by {@code delta}.
     */
    public void adjustTime(Duration delta) {
        Objects.requireNonNull(delta, "delta");
        if (delta.isZero()) {
            return;
        }
        editGeometry(sequence -> sequence.adjustTime(delta));
    }

    /**
     * Starts a new segment at every pause longer than {@code minimumPause}, at every
     * backwards time step, and at every jump farther than 5 km.
     *
     * @return true if segments changed.
     */
    public boolean splitAtStops(Duration minimumPause) {
        Objects.requireNonNull(minimumPause, "minimumPause");
        loadFull();
        if (!geo.splitAtJumps(minimumPause, STOP_SPLIT_DISTANCE_METERS)) {
            return false;
        }
        markDirty(RecordField.GPX);
        return true;
    }

    public double pointsHash() {
        loadFull();
        return geo.pointsHash();
    }

    /**
     * Time offset between both records when start and end are shifted alike, else {@code null}.
     */
    public Duration timeOffset(Record other) {
        return geo().timeOffset(other.geo());
    }

    /**
     * Likeness in {@code [0, 1]}, cached on both records until either geometry changes.
     */
    public double similarity(Record other) {
        Objects.requireNonNull(other, "other");
        if (other == this) {
            return 1.0d;
        }
        Double cached = similarities.get(other);
        if (cached != null) {
            return cached;
        }
        double result = SimilarityEstimator.defaults().estimate(geo(), other.geo());
        similarities.put(other, result);
        other.similarities.put(this, result);
        return result;
    }

    /**
     * Highest similarity against any of {@code others}, {@code 0} if empty.
     */
    public double similarity(Collection<Record> others) {
        double best = 0.0d;
        for (Record other : others) {
            best = Math.max(best, similarity(other));
        }
        return best;
    }

    private void invalidateGeometryCaches() {
        cachedDistanceKm = null;
        for (Record partner : new ArrayList<>(similarities.keySet())) {
            partner.similarities.remove(this);
        }
        similarities.clear();
    }

    // ------------------------------------------------------------------
    // Derived views
    // ------------------------------------------------------------------

    /**
     * Unattached deep copy.
     *
     * <p>When this record is saved, {@code <collection>/<identity>} is prepended to the
     * copy's cross ids.</p>
     */
    public Record detachedCopy() {
        loadFull();
        Record result = new Record(geo);
        result.title = title;
        result.description = description;
        result.category = category;
        result.visible = visible;
        result.tags = tags;
        List<String> ids = new ArrayList<>();
        if (host != null && identity != null) {
            ids.add(CrossIds.compose(host.identifier(), identity));
        }
        ids.addAll(crossIds);
        result.crossIds = CrossIds.clean(ids);
        return result;
    }

    /**
     * Key for fast equality checks: metadata, last time, bearing and point count.
     */
    public String equalityKey() {
        return equalityKey(true, true);
    }

    public String equalityKey(boolean withCategory, boolean withLastTime) {
        loadFull();
        return "title:" + title
                + " description:" + description
                + " keywords:" + String.join(",", tags).toLowerCase(Locale.ROOT)
                + " category:" + (withCategory ? category.displayName() : "")
                + " public:" + visible
                + " last_time:" + (withLastTime ? String.valueOf(geo.lastTime()) : "")
                + " angle:" + GeoDistance.round(geo.bearing(), 6)
                + " points:" + geo.pointCount();
    }

    /**
     * Easy to spot problems, empty if none.
     */
    public List<String> warnings() {
        List<String> result = new ArrayList<>();
        if (lastTime() == null) {
            return result;
        }
        double speed = speedKmh();
        double movingSpeed = movingSpeedKmh();
        // distance is rounded to meters, the moving speed is not
        if (speed > movingSpeed && !GeoDistance.isClose(speed, movingSpeed, SPEED_TOLERANCE)) {
            result.add(String.format(Locale.ROOT, "Speed %.3f must not be above Moving speed %.3f", speed, movingSpeed));
        }
        double[] expected = expectedSpeeds(category);
        if (expected.length == 0) {
            return result;
        }
        if (speed < expected[0]) {
            result.add(String.format(Locale.ROOT, "Speed %.3f is very low", speed));
        } else if (speed > expected[1]) {
            result.add(String.format(Locale.ROOT, "Speed %.3f is very high", speed));
        } else if (movingSpeed < expected[2]) {
            result.add(String.format(Locale.ROOT, "Moving speed %.3f is very low", movingSpeed));
        } else if (movingSpeed > expected[3]) {
            result.add(String.format(Locale.ROOT, "Moving speed %.3f is very high", movingSpeed));
        }
        return result;
    }

    // speed min, speed max, moving speed min, moving speed max
    private static double[] expectedSpeeds(Category category) {
        return switch (category) {
            case CYCLING -> new double[]{3.0d, 60.0d, 10.0d, 60.0d};
            case MOUNTAIN_BIKING -> new double[]{3.0d, 50.0d, 5.0d, 50.0d};
            default -> new double[0];
        };
    }

    /**
     * One-line description from what is in memory. Never loads.
     */
    public String summary() {
        try (SyncScope ignored = decouple()) {
            List<String> parts = new ArrayList<>();
            parts.add(isVisible() ? AttributeCodec.STATUS_PUBLIC : AttributeCodec.STATUS_PRIVATE);
            parts.add(category().displayName());
            if (!tags().isEmpty()) {
                parts.add(String.join(",", tags()));
            }
            if (!title().isEmpty()) {
                parts.add(title());
            }
            Instant first = firstTime();
            Instant last = loaded ? geo.lastTime() : null;
            if (first != null && last != null) {
                parts.add(TimeFormats.timespan(first, last));
            } else if (first != null) {
                parts.add(TimeFormats.instant(first));
            }
            double distance = distanceKm();
            if (distance > 0.0d) {
                parts.add(String.format(Locale.ROOT, "%4.2fkm", distance));
            }
            return this + "(" + String.join(" ", parts) + ")";
        }
    }

    /**
     * Full identifier {@code <collection>/<identity>}. Never loads.
     */
    @Override
    public String toString() {
        if (host == null) {
            String shownTitle = !title.isEmpty() ? title : header.getTitle() != null ? header.getTitle() : "untitled";
            return "unsaved: \"" + shownTitle + "\" time=" + TimeFormats.instant(geo.firstTime());
        }
        return host.identifier() + "/" + (identity == null ? "unsaved" : identity);
    }
}
