package geoscan.shape;

import java.io.Serializable;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The trained payload of a GEOSCAN model: every cluster and its boundary.
 *
 * <p>
 * Instances are immutable and may be shared freely between model copies.
 * Cluster order is preserved and cluster ids are unique.
 * </p>
 */
public final class GeoShape implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final GeoShape EMPTY = new GeoShape(Collections.emptyList());

    private final List<Cluster> clusters;

    public GeoShape(List<Cluster> clusters) {
        Objects.requireNonNull(clusters, "clusters must not be null");
        Set<String> ids = new HashSet<>();
        for (Cluster cluster : clusters) {
            Objects.requireNonNull(cluster, "cluster must not be null");
            if (!ids.add(cluster.getId())) {
                throw new IllegalArgumentException("Duplicate cluster id: " + cluster.getId());
            }
        }
        this.clusters = List.copyOf(clusters);
    }

    public static GeoShape empty() {
        return EMPTY;
    }

    public List<Cluster> getClusters() {
        return clusters;
    }

    public Optional<Cluster> getCluster(String id) {
        return clusters.stream().filter(c -> c.getId().equals(id)).findFirst();
    }

    public boolean isEmpty() {
        return clusters.isEmpty();
    }

    public int size() {
        return clusters.size();
    }

    /**
     * @return the GeoJSON encoding of this shape, see {@link GeoShapeCodec}
     */
    public String toGeoJson() {
        return GeoShapeCodec.toGeoJson(this);
    }

    public static GeoShape fromGeoJson(String geoJson) {
        return GeoShapeCodec.fromGeoJson(geoJson);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GeoShape)) {
            return false;
        }
        return clusters.equals(((GeoShape) o).clusters);
    }

    @Override
    public int hashCode() {
        return clusters.hashCode();
    }

    @Override
    public String toString() {
        return "GeoShape{clusters=" + clusters.size() + '}';
    }
}
