package geoscan.shape;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts a {@link GeoShape} to and from a single-line GeoJSON
 * {@code FeatureCollection}.
 *
 * <p>
 * Each cluster becomes one {@code Feature} whose {@code properties.cluster}
 * holds the cluster id and whose geometry is a {@code Polygon} with a single
 * ring. Coordinates are written as {@code [lng, lat]} in the order the
 * boundary was stored, so a round trip reproduces the shape exactly.
 * </p>
 */
public final class GeoShapeCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    static final String CLUSTER_PROPERTY = "cluster";

    private GeoShapeCodec() {
    }

    public static String toGeoJson(GeoShape shape) {
        Objects.requireNonNull(shape, "shape must not be null");

        ObjectNode collection = MAPPER.createObjectNode();
        collection.put("type", "FeatureCollection");
        ArrayNode features = collection.putArray("features");

        for (Cluster cluster : shape.getClusters()) {
            ObjectNode feature = features.addObject();
            feature.put("type", "Feature");
            feature.putObject("properties").put(CLUSTER_PROPERTY, cluster.getId());

            ObjectNode geometry = feature.putObject("geometry");
            geometry.put("type", "Polygon");
            ArrayNode ring = geometry.putArray("coordinates").addArray();
            for (GeoPoint point : cluster.getPoints()) {
                ring.addArray().add(point.lng()).add(point.lat());
            }
        }

        try {
            return MAPPER.writeValueAsString(collection);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode shape as GeoJSON", e);
        }
    }

    /**
     * Parse a GeoJSON {@code FeatureCollection} of cluster polygons.
     *
     * @throws IllegalArgumentException if the text is not valid JSON or does
     *                                  not describe cluster polygons
     */
    public static GeoShape fromGeoJson(String geoJson) {
        Objects.requireNonNull(geoJson, "GeoJSON text must not be null");

        JsonNode root;
        try {
            root = MAPPER.readTree(geoJson);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed GeoJSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("GeoJSON root must be an object");
        }
        if (!"FeatureCollection".equals(root.path("type").asText())) {
            throw new IllegalArgumentException(
                    "Expected a FeatureCollection, got type '" + root.path("type").asText() + "'");
        }
        JsonNode features = root.path("features");
        if (!features.isArray()) {
            throw new IllegalArgumentException("FeatureCollection has no 'features' array");
        }

        List<Cluster> clusters = new ArrayList<>(features.size());
        for (JsonNode feature : features) {
            clusters.add(readCluster(feature, clusters.size()));
        }
        return new GeoShape(clusters);
    }

    private static Cluster readCluster(JsonNode feature, int index) {
        String id = readId(feature);
        if (id == null) {
            throw new IllegalArgumentException("Feature #" + index + " has no cluster id");
        }

        JsonNode geometry = feature.path("geometry");
        if (!"Polygon".equals(geometry.path("type").asText())) {
            throw new IllegalArgumentException(
                    "Cluster " + id + " geometry must be a Polygon, got '"
                            + geometry.path("type").asText() + "'");
        }
        JsonNode rings = geometry.path("coordinates");
        if (!rings.isArray() || rings.isEmpty() || !rings.get(0).isArray()) {
            throw new IllegalArgumentException("Cluster " + id + " has no boundary ring");
        }

        List<GeoPoint> points = new ArrayList<>();
        for (JsonNode coordinate : rings.get(0)) {
            if (!coordinate.isArray() || coordinate.size() < 2
                    || !coordinate.get(0).isNumber() || !coordinate.get(1).isNumber()) {
                throw new IllegalArgumentException(
                        "Cluster " + id + " has an invalid coordinate: " + coordinate);
            }
            points.add(new GeoPoint(coordinate.get(1).doubleValue(), coordinate.get(0).doubleValue()));
        }
        return new Cluster(id, points);
    }

    private static String readId(JsonNode feature) {
        JsonNode id = feature.path("properties").path(CLUSTER_PROPERTY);
        if (id.isMissingNode() || id.isNull()) {
            id = feature.path("id");
        }
        if (id.isTextual() || id.isNumber()) {
            return id.asText();
        }
        return null;
    }
}
