package geoscan.index;

import geoscan.shape.Cluster;
import geoscan.shape.GeoPoint;
import geoscan.shape.GeoShape;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reduces a tile table to one cluster per cell.
 *
 * <p>
 * A cell claimed by several clusters goes to the cluster whose centroid is
 * nearest to the cell centre; equal distances go to the smallest cluster id.
 * The result is independent of input order.
 * </p>
 */
public final class TileResolver {

    private static final Logger LOG = LoggerFactory.getLogger(TileResolver.class);

    private static final GeometryFactory GEOMETRY = new GeometryFactory();

    private final SpatialIndex index;

    public TileResolver(SpatialIndex index) {
        this.index = Objects.requireNonNull(index, "index must not be null");
    }

    /**
     * @param shape the clusters the tiles were expanded from
     * @param tiles tiles, possibly with several clusters per cell
     * @return at most one tile per cell id, sorted by cluster id then cell id
     */
    public List<Tile> resolve(GeoShape shape, List<Tile> tiles) {
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(tiles, "tiles must not be null");

        Map<String, Set<String>> claims = new TreeMap<>();
        for (Tile tile : tiles) {
            claims.computeIfAbsent(tile.cellId(), k -> new LinkedHashSet<>()).add(tile.clusterId());
        }

        Map<String, GeoPoint> centroids = new HashMap<>();
        List<Tile> resolved = new ArrayList<>(claims.size());
        int contested = 0;
        for (Map.Entry<String, Set<String>> claim : claims.entrySet()) {
            Set<String> clusterIds = claim.getValue();
            if (clusterIds.size() == 1) {
                resolved.add(new Tile(clusterIds.iterator().next(), claim.getKey()));
                continue;
            }
            contested++;
            GeoPoint center = index.cellCenter(claim.getKey());
            String winner = null;
            double best = Double.POSITIVE_INFINITY;
            for (String clusterId : clusterIds) {
                GeoPoint centroid = centroids.computeIfAbsent(clusterId, id -> centroidOf(shape, id));
                double d = index.distanceMeters(center, centroid);
                if (winner == null || d < best || (d == best && clusterId.compareTo(winner) < 0)) {
                    best = d;
                    winner = clusterId;
                }
            }
            resolved.add(new Tile(winner, claim.getKey()));
        }

        if (contested > 0) {
            LOG.info("Resolved {} cell(s) claimed by more than one cluster", contested);
        }
        resolved.sort(Tile.ORDER);
        return resolved;
    }

    static GeoPoint centroidOf(GeoShape shape, String clusterId) {
        Cluster cluster = shape.getCluster(clusterId).orElseThrow(
                () -> new IllegalArgumentException("Tile refers to unknown cluster: " + clusterId));
        return centroid(cluster);
    }

    /**
     * Polygon centroid, or the mean of the vertices when the boundary does
     * not enclose an area.
     */
    static GeoPoint centroid(Cluster cluster) {
        List<GeoPoint> ring = cluster.openRing();
        Geometry geometry;
        if (cluster.isPolygon()) {
            Coordinate[] coordinates = new Coordinate[ring.size() + 1];
            for (int i = 0; i < ring.size(); i++) {
                coordinates[i] = new Coordinate(ring.get(i).lng(), ring.get(i).lat());
            }
            coordinates[ring.size()] = coordinates[0];
            geometry = GEOMETRY.createPolygon(coordinates);
        } else {
            Coordinate[] coordinates = ring.stream()
                    .map(p -> new Coordinate(p.lng(), p.lat()))
                    .toArray(Coordinate[]::new);
            geometry = GEOMETRY.createMultiPointFromCoords(coordinates);
        }
        Point centroid = geometry.getCentroid();
        if (centroid.isEmpty()) {
            centroid = GEOMETRY.createMultiPointFromCoords(geometry.getCoordinates()).getCentroid();
        }
        return new GeoPoint(centroid.getY(), centroid.getX());
    }
}
