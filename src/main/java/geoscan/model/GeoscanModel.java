package geoscan.model;

import geoscan.index.H3SpatialIndex;
import geoscan.index.PrecisionSelector;
import geoscan.index.SpatialIndex;
import geoscan.index.Tile;
import geoscan.index.TileExpander;
import geoscan.index.TileResolver;
import geoscan.io.GeoscanModelReader;
import geoscan.io.GeoscanModelWriter;
import geoscan.shape.GeoPoint;
import geoscan.shape.GeoShape;
import org.apache.spark.ml.util.Identifiable$;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.expressions.UserDefinedFunction;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.NumericType;
import org.apache.spark.sql.types.StructField;
import org.apache.spark.sql.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static org.apache.spark.sql.functions.broadcast;
import static org.apache.spark.sql.functions.col;
import static org.apache.spark.sql.functions.udf;

/**
 * Spark model holding every GEOSCAN cluster and scoring points against them.
 *
 * <p>
 * Inference does not run point-in-polygon tests. Each cluster is expanded
 * into the H3 cells that cover it, each point is mapped to its H3 cell at
 * the same resolution, and the two meet in a left-outer join. Points outside
 * every cluster keep their row with a {@code null} prediction.
 * </p>
 */
public final class GeoscanModel implements SpatialModel<GeoscanModel> {

    private static final Logger LOG = LoggerFactory.getLogger(GeoscanModel.class);

    /** Cell column of {@link #getTiles(SparkSession, int, int)}. */
    public static final String TILE_CELL_COL = "h3";

    private static final String RECORD_CELL_COL = "__geoscan_cell";
    private static final String JOIN_CELL_COL = "__geoscan_tile_cell";

    private final String uid;
    private final GeoShape shape;
    private final GeoscanParams params;
    private final SpatialIndex index;

    public GeoscanModel(GeoShape shape, GeoscanParams params) {
        this(Identifiable$.MODULE$.randomUID("GeoscanModel"), shape, params);
    }

    public GeoscanModel(String uid, GeoShape shape, GeoscanParams params) {
        this(uid, shape, params, H3SpatialIndex.instance());
    }

    /**
     * @param index grid used for tiles and point lookup; H3 unless testing
     */
    public GeoscanModel(String uid, GeoShape shape, GeoscanParams params, SpatialIndex index) {
        this.uid = Objects.requireNonNull(uid, "uid must not be null");
        this.shape = Objects.requireNonNull(shape, "shape must not be null");
        this.params = Objects.requireNonNull(params, "params must not be null");
        this.index = Objects.requireNonNull(index, "index must not be null");
        if (uid.isBlank()) {
            throw new IllegalArgumentException("uid must not be blank");
        }
    }

    @Override
    public String uid() {
        return uid;
    }

    public String getUid() {
        return uid;
    }

    public GeoShape getShape() {
        return shape;
    }

    public GeoscanParams getParams() {
        return params;
    }

    public SpatialIndex getIndex() {
        return index;
    }

    /**
     * @return the grid resolution matching this model's epsilon
     * @throws geoscan.index.ModelConfigurationException if none fits
     */
    public int getPrecision() {
        return new PrecisionSelector(index).selectPrecision(params.getEpsilon());
    }

    public String toGeoJson() {
        return shape.toGeoJson();
    }

    /**
     * Every (cluster, cell) pair at the given resolution, without settling
     * cells shared by several clusters.
     *
     * @return columns {@code predictionCol} and {@value #TILE_CELL_COL}
     */
    public Dataset<Row> getTiles(SparkSession spark, int precision, int layers) {
        List<Tile> tiles = new TileExpander(index).expand(shape.getClusters(), precision, layers);
        return toTileTable(spark, tiles, TILE_CELL_COL);
    }

    /**
     * The tile table used by {@link #transform(Dataset)}: one cluster per cell.
     */
    public List<Tile> resolvedTiles(int precision) {
        List<Tile> tiles = new TileExpander(index).expand(shape.getClusters(), precision, params.getLayers());
        return new TileResolver(index).resolve(shape, tiles);
    }

    @Override
    public GeoscanModel copy(Map<String, ?> extra) {
        return new GeoscanModel(uid, shape, params.merge(extra), index);
    }

    @Override
    public StructType transformSchema(StructType schema) {
        List<String> names = Arrays.asList(schema.fieldNames());
        requireNumeric(schema, names, params.getLatitudeCol());
        requireNumeric(schema, names, params.getLongitudeCol());
        if (names.contains(params.getPredictionCol())) {
            throw new IllegalArgumentException(
                    "Output column " + params.getPredictionCol() + " already exists.");
        }
        for (String reserved : List.of(RECORD_CELL_COL, JOIN_CELL_COL)) {
            if (names.contains(reserved)) {
                throw new IllegalArgumentException("Column name " + reserved + " is reserved.");
            }
        }
        return schema.add(params.getPredictionCol(), DataTypes.StringType, true);
    }

    /**
     * Enrich the dataset with the id of the cluster each point falls in.
     *
     * @return the original rows and columns plus a nullable prediction column
     */
    @Override
    public Dataset<Row> transform(Dataset<Row> dataset) {
        transformSchema(dataset.schema());

        // the same resolution must drive both sides of the join
        int precision = getPrecision();
        LOG.info("Scoring with model {} at H3 resolution {}", uid, precision);

        Dataset<Row> tiles = toTileTable(dataset.sparkSession(), resolvedTiles(precision), JOIN_CELL_COL);

        UserDefinedFunction toCell = udf(new CellIdUdf(index, precision), DataTypes.StringType);

        return dataset
                .withColumn(RECORD_CELL_COL, toCell.apply(
                        col(quoted(params.getLatitudeCol())).cast("double"),
                        col(quoted(params.getLongitudeCol())).cast("double")))
                .join(broadcast(tiles), col(RECORD_CELL_COL).equalTo(col(JOIN_CELL_COL)), "left_outer")
                .drop(RECORD_CELL_COL)
                .drop(JOIN_CELL_COL);
    }

    /**
     * Score a single point on the driver.
     *
     * @return the cluster the point falls in, if any
     */
    public Optional<String> predict(double lat, double lng) {
        if (!GeoPoint.isValid(lat, lng)) {
            return Optional.empty();
        }
        int precision = getPrecision();
        Map<String, String> byCell = new HashMap<>();
        for (Tile tile : resolvedTiles(precision)) {
            byCell.put(tile.cellId(), tile.clusterId());
        }
        return Optional.ofNullable(byCell.get(index.cellId(lat, lng, precision)));
    }

    @Override
    public GeoscanModelWriter write(SparkSession spark) {
        return new GeoscanModelWriter(spark, this);
    }

    public static GeoscanModelReader read(SparkSession spark) {
        return new GeoscanModelReader(spark);
    }

    public static GeoscanModel load(SparkSession spark, String path) throws IOException {
        return read(spark).load(path);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Dataset<Row> toTileTable(SparkSession spark, List<Tile> tiles, String cellCol) {
        List<Row> rows = new ArrayList<>(tiles.size());
        for (Tile tile : tiles) {
            rows.add(RowFactory.create(tile.clusterId(), tile.cellId()));
        }
        StructType schema = new StructType(new StructField[]{
                DataTypes.createStructField(params.getPredictionCol(), DataTypes.StringType, true),
                DataTypes.createStructField(cellCol, DataTypes.StringType, false)
        });
        return spark.createDataFrame(rows, schema);
    }

    /**
     * Backtick-quote a column name so dots are not read as struct access.
     */
    private static String quoted(String column) {
        return "`" + column.replace("`", "``") + "`";
    }

    private static void requireNumeric(StructType schema, List<String> names, String column) {
        if (!names.contains(column)) {
            throw new IllegalArgumentException(
                    "Column " + column + " does not exist. Available: " + String.join(", ", names));
        }
        if (!(schema.apply(column).dataType() instanceof NumericType)) {
            throw new IllegalArgumentException(
                    "Column " + column + " must be numeric but was "
                            + schema.apply(column).dataType().simpleString() + ".");
        }
    }

    @Override
    public String toString() {
        return "GeoscanModel{uid='" + uid + "', clusters=" + shape.size() + ", params=" + params + '}';
    }
}
