package org.Aayush.tracksync.core;

/**
 * A scoped mode switch that restores the previous mode when closed.
 *
 * <p>Used with try-with-resources. Scopes nest: closing an inner scope restores the
 * value that was active when it was opened, never a hard-coded default.</p>
 */
@FunctionalInterface
public interface SyncScope extends AutoCloseable {

    /**
     * Restores the previous mode. Implementations may perform deferred work here
     * and propagate its failures.
     */
    @Override
    void close();
}
