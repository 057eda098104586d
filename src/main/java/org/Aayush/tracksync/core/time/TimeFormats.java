package org.Aayush.tracksync.core.time;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Shared deterministic time rendering helpers for messages and diff reports.
 *
 * <p>All methods operate in UTC.</p>
 */
public final class TimeFormats {

    /** Rendering of a missing instant or duration. */
    public static final String MISSING = "-";

    private static final long SECONDS_PER_HOUR = 3600L;
    private static final long SECONDS_PER_MINUTE = 60L;

    private static final DateTimeFormatter DATE_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter TIME_ONLY =
            DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);

    /**
     * Prevents instantiation of this utility class.
     */
    private TimeFormats() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Renders the span between two instants as {@code h:mm}.
     *
     * <p>Hours are not wrapped at 24, so a two day span renders as {@code 48:00}.</p>
     *
     * @param start span start.
     * @param end span end.
     * @return rendered span.
     */
    public static String timespan(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end must be non-null");
        }
        long seconds = Duration.between(start, end).getSeconds();
        long hours = Math.floorDiv(seconds, SECONDS_PER_HOUR);
        long minutes = Math.floorMod(seconds, SECONDS_PER_HOUR) / SECONDS_PER_MINUTE;
        return String.format(Locale.ROOT, "%d:%02d", hours, minutes);
    }

    /**
     * Renders an instant as {@code yyyy-MM-dd HH:mm:ss}, or {@link #MISSING} when missing.
     */
    public static String instant(Instant value) {
        if (value == null) {
            return MISSING;
        }
        return DATE_TIME.format(value);
    }

    /**
     * Renders two instants for a "between A and B" phrase.
     *
     * <p>When both fall on the same UTC date, the second one is rendered as time of day only.</p>
     *
     * @return two-element array {@code [first, second]}.
     */
    public static String[] pair(Instant first, Instant second) {
        if (first == null || second == null) {
            return new String[]{instant(first), instant(second)};
        }
        LocalDateTime a = LocalDateTime.ofInstant(first, ZoneOffset.UTC);
        LocalDateTime b = LocalDateTime.ofInstant(second, ZoneOffset.UTC);
        if (a.toLocalDate().equals(b.toLocalDate())) {
            return new String[]{instant(first), TIME_ONLY.format(second)};
        }
        return new String[]{instant(first), instant(second)};
    }

    /**
     * Renders a signed duration as {@code [-]h:mm:ss}, or {@link #MISSING} when missing.
     */
    public static String duration(Duration value) {
        if (value == null) {
            return MISSING;
        }
        long seconds = value.getSeconds();
        String sign = seconds < 0 ? "-" : "";
        long abs = Math.abs(seconds);
        return String.format(
                Locale.ROOT,
                "%s%d:%02d:%02d",
                sign,
                abs / SECONDS_PER_HOUR,
                (abs % SECONDS_PER_HOUR) / SECONDS_PER_MINUTE,
                abs % SECONDS_PER_MINUTE
        );
    }
}
