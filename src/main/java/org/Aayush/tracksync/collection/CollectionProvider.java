package org.Aayush.tracksync.collection;

/**
 * Factory for one kind of collection, registered in {@link CollectionRegistry}.
 */
public interface CollectionProvider {

    /**
     * Url scheme handled by this provider, for example {@code memory}.
     */
    String scheme();

    /**
     * Opens the collection described by {@code config}.
     */
    RecordCollection create(CollectionConfig config);
}
