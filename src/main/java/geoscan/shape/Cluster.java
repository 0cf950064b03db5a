package geoscan.shape;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * One GEOSCAN cluster: a stable identifier and the polygon boundary that
 * encloses its points.
 *
 * <p>
 * The boundary is kept exactly as it was produced. A closing point equal to
 * the first one may or may not be present; consumers treat the ring as
 * implicitly closed either way.
 * </p>
 */
public final class Cluster implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final List<GeoPoint> points;

    public Cluster(String id, List<GeoPoint> points) {
        Objects.requireNonNull(id, "cluster id must not be null");
        Objects.requireNonNull(points, "cluster points must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("cluster id must not be blank");
        }
        if (points.isEmpty()) {
            throw new IllegalArgumentException("cluster " + id + " has no boundary points");
        }
        this.id = id;
        this.points = List.copyOf(points);
    }

    public String getId() {
        return id;
    }

    public List<GeoPoint> getPoints() {
        return points;
    }

    /**
     * @return true when the boundary has enough vertices to enclose an area
     */
    public boolean isPolygon() {
        return openRing().size() >= 3;
    }

    /**
     * The boundary without a trailing point that repeats the first one.
     */
    public List<GeoPoint> openRing() {
        int n = points.size();
        if (n > 1 && points.get(0).equals(points.get(n - 1))) {
            return points.subList(0, n - 1);
        }
        return points;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cluster)) {
            return false;
        }
        Cluster other = (Cluster) o;
        return id.equals(other.id) && points.equals(other.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, points);
    }

    @Override
    public String toString() {
        return "Cluster{id='" + id + "', points=" + points.size() + '}';
    }
}
