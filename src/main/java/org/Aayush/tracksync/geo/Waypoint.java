package org.Aayush.tracksync.geo;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;

/**
 * Named standalone point attached to a geo-sequence.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Waypoint {
    GeoPoint position;
    /** Display name, may be empty. */
    String name;

    public static Waypoint of(GeoPoint position, String name) {
        if (position == null) {
            throw new IllegalArgumentException("position cannot be null");
        }
        return new Waypoint(position, name == null ? "" : name);
    }

    public Waypoint shifted(Duration delta) {
        return new Waypoint(position.shifted(delta), name);
    }
}
