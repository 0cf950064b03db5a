package geoscan.index;

import com.uber.h3core.H3Core;
import com.uber.h3core.LengthUnit;
import com.uber.h3core.util.LatLng;
import geoscan.shape.GeoPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link SpatialIndex} backed by Uber's H3 hexagonal grid.
 *
 * <p>
 * The native {@link H3Core} is created once per JVM on first use, so the
 * index itself carries no state and serializes to nothing. Cell ids are the
 * 64-bit H3 index rendered as upper-case hex.
 * </p>
 */
public final class H3SpatialIndex implements SpatialIndex {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(H3SpatialIndex.class);

    private static final H3SpatialIndex INSTANCE = new H3SpatialIndex();

    public static final int MIN_RESOLUTION = 0;
    public static final int MAX_RESOLUTION = 15;

    private H3SpatialIndex() {
    }

    public static H3SpatialIndex instance() {
        return INSTANCE;
    }

    private Object readResolve() {
        return INSTANCE;
    }

    private static final class Holder {
        static final H3Core CORE = create();

        private static H3Core create() {
            try {
                H3Core core = H3Core.newInstance();
                LOG.info("H3 native library loaded");
                return core;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load the H3 native library", e);
            }
        }
    }

    private static H3Core h3() {
        return Holder.CORE;
    }

    @Override
    public int minPrecision() {
        return MIN_RESOLUTION;
    }

    @Override
    public int maxPrecision() {
        return MAX_RESOLUTION;
    }

    @Override
    public String cellId(double lat, double lng, int precision) {
        checkPrecision(precision);
        return format(h3().latLngToCell(lat, lng, precision));
    }

    @Override
    public Set<String> polyFill(List<GeoPoint> points, int precision, int layers) {
        checkPrecision(precision);
        if (layers < 0) {
            throw new IllegalArgumentException("layers must be >= 0, got: " + layers);
        }
        List<GeoPoint> ring = openRing(points);
        H3Core h3 = h3();

        Set<Long> cells = new HashSet<>();
        if (ring.size() >= 3) {
            cells.addAll(h3.polygonToCells(toLatLng(ring), Collections.emptyList(), precision));
        }

        // polygonToCells only keeps cells whose centre is inside, walk the boundary for the rest
        double step = edgeLengthMeters(precision) / 2.0;
        for (int i = 0; i < ring.size(); i++) {
            GeoPoint from = ring.get(i);
            GeoPoint to = ring.get((i + 1) % ring.size());
            traceSegment(h3, from, to, step, precision, cells);
        }

        if (layers > 0) {
            Set<Long> dilated = new HashSet<>(cells);
            for (long cell : cells) {
                dilated.addAll(h3.gridDisk(cell, layers));
            }
            cells = dilated;
        }

        Set<String> ids = new TreeSet<>();
        for (long cell : cells) {
            ids.add(format(cell));
        }
        return ids;
    }

    @Override
    public GeoPoint cellCenter(String cellId) {
        long cell = parse(cellId);
        LatLng center = h3().cellToLatLng(cell);
        return new GeoPoint(center.lat, center.lng);
    }

    @Override
    public double edgeLengthMeters(int precision) {
        checkPrecision(precision);
        return h3().getHexagonEdgeLengthAvg(precision, LengthUnit.m);
    }

    @Override
    public double distanceMeters(GeoPoint a, GeoPoint b) {
        return h3().greatCircleDistance(
                new LatLng(a.lat(), a.lng()), new LatLng(b.lat(), b.lng()), LengthUnit.m);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void traceSegment(H3Core h3, GeoPoint from, GeoPoint to, double step,
                              int precision, Set<Long> cells) {
        cells.add(h3.latLngToCell(from.lat(), from.lng(), precision));
        double length = distanceMeters(from, to);
        int samples = (int) Math.ceil(length / step);
        for (int s = 1; s <= samples; s++) {
            double f = (double) s / samples;
            double lat = from.lat() + (to.lat() - from.lat()) * f;
            double lng = from.lng() + (to.lng() - from.lng()) * f;
            cells.add(h3.latLngToCell(lat, lng, precision));
        }
    }

    private static List<GeoPoint> openRing(List<GeoPoint> points) {
        int n = points.size();
        if (n > 1 && points.get(0).equals(points.get(n - 1))) {
            return points.subList(0, n - 1);
        }
        return points;
    }

    private static List<LatLng> toLatLng(List<GeoPoint> points) {
        List<LatLng> result = new ArrayList<>(points.size());
        for (GeoPoint p : points) {
            result.add(new LatLng(p.lat(), p.lng()));
        }
        return result;
    }

    private static void checkPrecision(int precision) {
        if (precision < MIN_RESOLUTION || precision > MAX_RESOLUTION) {
            throw new IllegalArgumentException(
                    "H3 resolution must be in [" + MIN_RESOLUTION + ", " + MAX_RESOLUTION
                            + "], got: " + precision);
        }
    }

    static String format(long cell) {
        return Long.toHexString(cell).toUpperCase(Locale.ROOT);
    }

    static long parse(String cellId) {
        long cell;
        try {
            cell = Long.parseUnsignedLong(cellId, 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a hexadecimal H3 cell id: " + cellId, e);
        }
        if (!h3().isValidCell(cell)) {
            throw new IllegalArgumentException("Not a valid H3 cell: " + cellId);
        }
        return cell;
    }
}
