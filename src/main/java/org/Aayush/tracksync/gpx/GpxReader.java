package org.Aayush.tracksync.gpx;

import org.Aayush.tracksync.collection.StorageException;
import org.Aayush.tracksync.geo.GeoPoint;
import org.Aayush.tracksync.geo.GeoSequence;
import org.Aayush.tracksync.geo.Waypoint;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses GPX 1.0 and 1.1 text into a {@link GpxDocument}.
 *
 * <p>Name, description and keywords come from {@code metadata}, falling back to the
 * first {@code trk}. Every {@code trkseg} becomes one segment. Elements are matched
 * by local name, so the namespace version does not matter.</p>
 */
public final class GpxReader {

    private GpxReader() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * @throws StorageException with reason {@code MALFORMED_GPX} for unparsable input.
     */
    public static GpxDocument read(String xml) {
        Objects.requireNonNull(xml, "xml");
        Element root = parse(xml).getDocumentElement();
        if (!"gpx".equals(localName(root))) {
            throw malformed("root element is " + localName(root) + ", expected gpx", null);
        }
        try {
            Element metadata = child(root, "metadata");
            Element firstTrack = child(root, "trk");
            GeoSequence geo = new GeoSequence();
            for (Element waypoint : children(root, "wpt")) {
                geo.addWaypoint(Waypoint.of(point(waypoint), text(child(waypoint, "name"))));
            }
            for (Element track : children(root, "trk")) {
                for (Element segment : children(track, "trkseg")) {
                    List<GeoPoint> points = new ArrayList<>();
                    for (Element trackPoint : children(segment, "trkpt")) {
                        points.add(point(trackPoint));
                    }
                    geo.addSegment(points);
                }
            }
            String fallbackTime = text(child(metadata, "time"));
            if (!fallbackTime.isEmpty()) {
                geo.setFallbackTime(Instant.parse(fallbackTime));
            }
            return GpxDocument.builder()
                    .title(firstNonEmpty(text(child(metadata, "name")), text(child(firstTrack, "name"))))
                    .description(firstNonEmpty(text(child(metadata, "desc")), text(child(firstTrack, "desc"))))
                    .keywords(firstNonEmpty(text(child(metadata, "keywords")), text(child(firstTrack, "keywords"))))
                    .geo(geo)
                    .build();
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw malformed(e.getMessage(), e);
        }
    }

    private static Document parse(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw malformed(e.getMessage(), e);
        }
    }

    private static GeoPoint point(Element element) {
        double latitude = Double.parseDouble(element.getAttribute("lat"));
        double longitude = Double.parseDouble(element.getAttribute("lon"));
        String elevation = text(child(element, "ele"));
        String time = text(child(element, "time"));
        return GeoPoint.of(
                latitude,
                longitude,
                elevation.isEmpty() ? null : Double.valueOf(elevation),
                time.isEmpty() ? null : Instant.parse(time));
    }

    private static Element child(Element parent, String name) {
        if (parent == null) {
            return null;
        }
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(node))) {
                return (Element) node;
            }
        }
        return null;
    }

    private static List<Element> children(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(node))) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    private static String text(Element element) {
        return element == null ? "" : element.getTextContent().strip();
    }

    private static String firstNonEmpty(String first, String second) {
        return first.isEmpty() ? second : first;
    }

    private static StorageException malformed(String message, Throwable cause) {
        return new StorageException(StorageException.REASON_MALFORMED_GPX, "cannot parse GPX: " + message, cause);
    }
}
