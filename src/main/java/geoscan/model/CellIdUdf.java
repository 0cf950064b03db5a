package geoscan.model;

import geoscan.index.SpatialIndex;
import geoscan.shape.GeoPoint;
import org.apache.spark.sql.api.java.UDF2;

import java.util.Objects;

/**
 * Spark UDF mapping a (latitude, longitude) pair to its grid cell id.
 *
 * <p>
 * Null or out-of-range coordinates map to {@code null}, which never joins.
 * </p>
 */
public final class CellIdUdf implements UDF2<Double, Double, String> {

    private static final long serialVersionUID = 1L;

    private final SpatialIndex index;
    private final int precision;

    public CellIdUdf(SpatialIndex index, int precision) {
        this.index = Objects.requireNonNull(index, "index must not be null");
        this.precision = precision;
    }

    @Override
    public String call(Double lat, Double lng) {
        if (lat == null || lng == null || !GeoPoint.isValid(lat, lng)) {
            return null;
        }
        return index.cellId(lat, lng, precision);
    }
}
