package geoscan.model;

import geoscan.io.ModelWriter;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.types.StructType;

import java.io.IOException;
import java.util.Map;

/**
 * A fitted model that enriches a dataset and can be persisted.
 *
 * @param <M> the concrete model type
 */
public interface SpatialModel<M extends SpatialModel<M>> {

    String uid();

    /**
     * Validate an input schema and describe the output.
     *
     * @throws IllegalArgumentException if the input cannot be scored
     */
    StructType transformSchema(StructType schema);

    /**
     * @return every input row and column, plus the model's output column
     */
    Dataset<Row> transform(Dataset<Row> dataset);

    /**
     * @return a new model with the same uid and data and the given param
     * overrides applied
     */
    M copy(Map<String, ?> extra);

    ModelWriter write(SparkSession spark);

    default void save(SparkSession spark, String path) throws IOException {
        write(spark).save(path);
    }
}
