package geoscan.index;

import geoscan.shape.GeoPoint;

import java.io.Serializable;
import java.util.List;
import java.util.Set;

/**
 * A discrete global grid that maps coordinates to fixed-resolution cells.
 *
 * <p>
 * Cell ids are upper-case hexadecimal strings and are used as literal join
 * keys, so every implementation must be deterministic. Implementations are
 * shipped to Spark executors and must therefore be serializable.
 * </p>
 */
public interface SpatialIndex extends Serializable {

    /** Coarsest supported resolution. */
    int minPrecision();

    /** Finest supported resolution. */
    int maxPrecision();

    /**
     * @return the id of the cell containing the point at the given resolution
     */
    String cellId(double lat, double lng, int precision);

    /**
     * Cover a polygon boundary with cells.
     *
     * @param points    the boundary, closed or implicitly closed
     * @param precision grid resolution
     * @param layers    number of neighbour rings added around the covering
     *                  cells, {@code 0} for none
     * @return the distinct covering cell ids
     */
    Set<String> polyFill(List<GeoPoint> points, int precision, int layers);

    /**
     * @return the centre of a cell
     */
    GeoPoint cellCenter(String cellId);

    /**
     * @return the average cell edge length at the given resolution, in metres
     */
    double edgeLengthMeters(int precision);

    /**
     * @return the great-circle distance between two points, in metres
     */
    double distanceMeters(GeoPoint a, GeoPoint b);
}
