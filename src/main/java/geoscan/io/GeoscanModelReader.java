package geoscan.io;

import geoscan.model.GeoscanModel;
import geoscan.model.GeoscanParams;
import geoscan.shape.GeoShape;
import geoscan.shape.GeoShapeCodec;
import org.apache.hadoop.fs.Path;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Loads a {@link GeoscanModel} written by {@link GeoscanModelWriter}.
 */
public class GeoscanModelReader implements ModelReader<GeoscanModel> {

    private static final Logger LOG = LoggerFactory.getLogger(GeoscanModelReader.class);

    private final SparkSession spark;

    public GeoscanModelReader(SparkSession spark) {
        this.spark = Objects.requireNonNull(spark, "spark session must not be null");
    }

    @Override
    public GeoscanModel load(String path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        ModelIO.requireExists(spark, path, "directory");

        ModelMetadata metadata = ModelIO.loadMetadata(spark, path, GeoscanModel.class.getName());
        GeoscanParams params;
        try {
            params = GeoscanParams.fromMap(metadata.getParamMap());
        } catch (IllegalArgumentException e) {
            throw new CorruptModelException("Invalid parameters in model metadata at " + path, e);
        }

        GeoShape shape = loadData(path);
        LOG.info("Loaded model {} with {} cluster(s) from {}", metadata.getUid(), shape.size(), path);
        return new GeoscanModel(metadata.getUid(), shape, params);
    }

    private GeoShape loadData(String path) throws IOException {
        String dataPath = new Path(path, ModelIO.DATA).toString();
        String geoJson = ModelIO.readSingleRecord(spark, dataPath, ModelIO.DATA);
        try {
            return GeoShapeCodec.fromGeoJson(geoJson);
        } catch (IllegalArgumentException e) {
            throw new CorruptModelException("Malformed model data at " + dataPath, e);
        }
    }
}
