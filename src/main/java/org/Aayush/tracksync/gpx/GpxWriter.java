package org.Aayush.tracksync.gpx;

import org.Aayush.tracksync.geo.GeoPoint;
import org.Aayush.tracksync.geo.GeoSequence;
import org.Aayush.tracksync.geo.Waypoint;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Serializes {@link GpxDocument} as GPX 1.1 with one track point per line.
 *
 * <p>Output is deterministic for equal input, so stored text can be compared directly.</p>
 */
public final class GpxWriter {
    public static final String NAMESPACE = "http://www.topografix.com/GPX/1/1";
    private static final String CREATOR = "tracksync";

    private GpxWriter() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String write(GpxDocument document) {
        Objects.requireNonNull(document, "document");
        GeoSequence geo = document.getGeo();
        StringBuilder out = new StringBuilder(256 + geo.pointCount() * 96);
        out.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        out.append("<gpx xmlns=\"").append(NAMESPACE).append("\" version=\"1.1\" creator=\"")
                .append(CREATOR).append("\">\n");
        out.append("<metadata>\n");
        element(out, "name", document.getTitle());
        element(out, "desc", document.getDescription());
        if (geo.isEmpty() && geo.fallbackTime() != null) {
            element(out, "time", geo.fallbackTime().toString());
        }
        element(out, "keywords", document.getKeywords());
        out.append("</metadata>\n");
        for (Waypoint waypoint : geo.waypoints()) {
            point(out, "wpt", waypoint.getPosition(), waypoint.getName());
        }
        List<List<GeoPoint>> segments = geo.segments();
        if (!segments.isEmpty()) {
            out.append("<trk>\n");
            for (List<GeoPoint> segment : segments) {
                out.append("<trkseg>\n");
                for (GeoPoint point : segment) {
                    point(out, "trkpt", point, null);
                }
                out.append("</trkseg>\n");
            }
            out.append("</trk>\n");
        }
        out.append("</gpx>\n");
        return out.toString();
    }

    private static void element(StringBuilder out, String name, String value) {
        if (value == null || value.isEmpty()) {
            return;
        }
        out.append('<').append(name).append('>').append(escape(value)).append("</").append(name).append(">\n");
    }

    private static void point(StringBuilder out, String tag, GeoPoint point, String name) {
        out.append('<').append(tag)
                .append(" lat=\"").append(number(point.latitude()))
                .append("\" lon=\"").append(number(point.longitude())).append("\">");
        if (point.elevation() != null) {
            out.append("<ele>").append(number(point.elevation())).append("</ele>");
        }
        Instant time = point.time();
        if (time != null) {
            out.append("<time>").append(time).append("</time>");
        }
        if (name != null && !name.isEmpty()) {
            out.append("<name>").append(escape(name)).append("</name>");
        }
        out.append("</").append(tag).append(">\n");
    }

    static String number(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static String escape(String value) {
        StringBuilder result = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> result.append("&amp;");
                case '<' -> result.append("&lt;");
                case '>' -> result.append("&gt;");
                case '"' -> result.append("&quot;");
                default -> result.append(c);
            }
        }
        return result.toString();
    }
}
