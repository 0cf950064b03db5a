package geoscan.io;

import geoscan.model.GeoscanModel;
import org.apache.hadoop.fs.Path;
import org.apache.spark.sql.SparkSession;

import java.io.IOException;
import java.util.Objects;

/**
 * Persists a {@link GeoscanModel} as JSON metadata plus the cluster shapes
 * as a single GeoJSON record.
 */
public class GeoscanModelWriter extends ModelWriter {

    private final GeoscanModel instance;

    public GeoscanModelWriter(SparkSession spark, GeoscanModel instance) {
        super(spark);
        this.instance = Objects.requireNonNull(instance, "model must not be null");
    }

    @Override
    public GeoscanModelWriter overwrite() {
        super.overwrite();
        return this;
    }

    @Override
    protected void saveImpl(String path) throws IOException {
        ModelIO.saveMetadata(spark, path, GeoscanModel.class.getName(),
                instance.getUid(), instance.getParams().toMap());
        saveData(path);
    }

    private void saveData(String path) {
        String dataPath = new Path(path, ModelIO.DATA).toString();
        ModelIO.writeText(spark, dataPath, instance.toGeoJson());
    }
}
