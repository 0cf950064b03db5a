package geoscan.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable parameters of a {@link GeoscanModel}.
 *
 * <p>
 * {@link #toMap()} and {@link #fromMap(Map)} give the {@code paramMap} form
 * persisted in model metadata. Use the {@link Builder} everywhere else; it
 * validates at {@link Builder#build()} time.
 * </p>
 */
public final class GeoscanParams implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String EPSILON = "epsilon";
    public static final String LATITUDE_COL = "latitudeCol";
    public static final String LONGITUDE_COL = "longitudeCol";
    public static final String PREDICTION_COL = "predictionCol";
    public static final String LAYERS = "layers";

    private final double epsilon;
    private final String latitudeCol;
    private final String longitudeCol;
    private final String predictionCol;
    private final int layers;

    private GeoscanParams(Builder b) {
        this.epsilon = b.epsilon;
        this.latitudeCol = b.latitudeCol;
        this.longitudeCol = b.longitudeCol;
        this.predictionCol = b.predictionCol;
        this.layers = b.layers;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-filled with these values
     */
    public Builder toBuilder() {
        return new Builder()
                .epsilon(epsilon)
                .latitudeCol(latitudeCol)
                .longitudeCol(longitudeCol)
                .predictionCol(predictionCol)
                .layers(layers);
    }

    /** Distance scale of the clustering, in metres. */
    public double getEpsilon() {
        return epsilon;
    }

    public String getLatitudeCol() {
        return latitudeCol;
    }

    public String getLongitudeCol() {
        return longitudeCol;
    }

    public String getPredictionCol() {
        return predictionCol;
    }

    /** Neighbour rings added around each cluster at inference time. */
    public int getLayers() {
        return layers;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(EPSILON, epsilon);
        map.put(LATITUDE_COL, latitudeCol);
        map.put(LONGITUDE_COL, longitudeCol);
        map.put(PREDICTION_COL, predictionCol);
        map.put(LAYERS, layers);
        return Collections.unmodifiableMap(map);
    }

    /**
     * Build parameters from a persisted param map. Missing entries keep their
     * defaults, except {@code epsilon} which is required.
     *
     * @throws IllegalArgumentException if a value has the wrong type, is out
     *                                  of range, or epsilon is missing
     */
    public static GeoscanParams fromMap(Map<String, ?> map) {
        Objects.requireNonNull(map, "param map must not be null");
        if (!map.containsKey(EPSILON)) {
            throw new IllegalArgumentException("param map has no '" + EPSILON + "' entry");
        }
        return withOverrides(new Builder(), map).build();
    }

    /**
     * @return a copy with the given entries replacing the current values
     */
    public GeoscanParams merge(Map<String, ?> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        return withOverrides(toBuilder(), overrides).build();
    }

    private static Builder withOverrides(Builder b, Map<String, ?> map) {
        for (Map.Entry<String, ?> e : map.entrySet()) {
            Object v = e.getValue();
            switch (e.getKey()) {
                case EPSILON -> b.epsilon(number(EPSILON, v).doubleValue());
                case LATITUDE_COL -> b.latitudeCol(text(LATITUDE_COL, v));
                case LONGITUDE_COL -> b.longitudeCol(text(LONGITUDE_COL, v));
                case PREDICTION_COL -> b.predictionCol(text(PREDICTION_COL, v));
                case LAYERS -> {
                    Number n = number(LAYERS, v);
                    if (n.doubleValue() != n.intValue()) {
                        throw new IllegalArgumentException("layers must be an integer, got: " + v);
                    }
                    b.layers(n.intValue());
                }
                default -> throw new IllegalArgumentException("Unknown GEOSCAN param: " + e.getKey());
            }
        }
        return b;
    }

    private static Number number(String name, Object v) {
        if (v instanceof Number) {
            return (Number) v;
        }
        throw new IllegalArgumentException(name + " must be a number, got: " + v);
    }

    private static String text(String name, Object v) {
        if (v instanceof String) {
            return (String) v;
        }
        throw new IllegalArgumentException(name + " must be a string, got: " + v);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GeoscanParams)) {
            return false;
        }
        GeoscanParams other = (GeoscanParams) o;
        return Double.compare(epsilon, other.epsilon) == 0
                && layers == other.layers
                && latitudeCol.equals(other.latitudeCol)
                && longitudeCol.equals(other.longitudeCol)
                && predictionCol.equals(other.predictionCol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(epsilon, latitudeCol, longitudeCol, predictionCol, layers);
    }

    @Override
    public String toString() {
        return "GeoscanParams{" +
                "epsilon=" + epsilon +
                ", latitudeCol='" + latitudeCol + '\'' +
                ", longitudeCol='" + longitudeCol + '\'' +
                ", predictionCol='" + predictionCol + '\'' +
                ", layers=" + layers +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link GeoscanParams}.
     */
    public static class Builder {
        private double epsilon = Double.NaN;
        private String latitudeCol = "latitude";
        private String longitudeCol = "longitude";
        private String predictionCol = "cluster";
        private int layers = 0;

        public Builder epsilon(double v) {
            this.epsilon = v;
            return this;
        }

        public Builder latitudeCol(String v) {
            this.latitudeCol = v;
            return this;
        }

        public Builder longitudeCol(String v) {
            this.longitudeCol = v;
            return this;
        }

        public Builder predictionCol(String v) {
            this.predictionCol = v;
            return this;
        }

        public Builder layers(int v) {
            this.layers = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is invalid
         */
        public GeoscanParams build() {
            if (!Double.isFinite(epsilon) || epsilon <= 0) {
                throw new IllegalArgumentException("epsilon must be a positive finite number, got: " + epsilon);
            }
            requireNonBlank(latitudeCol, LATITUDE_COL);
            requireNonBlank(longitudeCol, LONGITUDE_COL);
            requireNonBlank(predictionCol, PREDICTION_COL);
            if (latitudeCol.equals(longitudeCol)) {
                throw new IllegalArgumentException("latitude and longitude columns must differ: " + latitudeCol);
            }
            if (predictionCol.equals(latitudeCol) || predictionCol.equals(longitudeCol)) {
                throw new IllegalArgumentException(
                        "prediction column must not be a coordinate column: " + predictionCol);
            }
            if (layers < 0) {
                throw new IllegalArgumentException("layers must be >= 0, got: " + layers);
            }
            return new GeoscanParams(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }
}
