package geoscan;

import geoscan.config.ScoringConfig;
import geoscan.model.GeoscanModel;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;

import java.io.IOException;

import static org.apache.spark.sql.functions.col;

/**
 * Batch scoring job: tags every record of a dataset with the GEOSCAN cluster
 * it falls in.
 *
 * <pre>
 * Main [model-path input-path output-path]
 * </pre>
 * Arguments override {@code GEOSCAN_MODEL_PATH}, {@code GEOSCAN_INPUT_PATH}
 * and {@code GEOSCAN_OUTPUT_PATH}.
 */
public class Main {

    public static void main(String[] args) throws IOException {

        if (args.length != 0 && args.length != 3) {
            System.err.println("Usage: Main [<model-path> <input-path> <output-path>]");
            System.exit(1);
        }

        ScoringConfig.Builder builder = ScoringConfig.fromEnvironment();
        if (args.length == 3) {
            builder.modelPath(args[0]).inputPath(args[1]).outputPath(args[2]);
        }
        ScoringConfig config = builder.build();

        SparkSession spark = SparkSession.builder()
                .appName(config.getAppName())
                .getOrCreate();

        spark.sparkContext().setLogLevel("WARN");

        System.out.println("\n=== Loading model: " + config.getModelPath() + " ===");
        GeoscanModel model = GeoscanModel.load(spark, config.getModelPath());
        System.out.println("Clusters = " + model.getShape().size()
                + ", H3 resolution = " + model.getPrecision());

        Dataset<Row> points = readInput(spark, config);
        System.out.println("\n=== Input schema ===");
        points.printSchema();

        Dataset<Row> scored = model.transform(points);

        String predictionCol = model.getParams().getPredictionCol();
        System.out.println("\n=== Points per cluster ===");
        scored.groupBy(col(predictionCol)).count().orderBy(col("count").desc()).show(20, false);

        scored.write()
                .mode(config.getOutputMode())
                .parquet(config.getOutputPath());

        System.out.println("\n=== Wrote scored records to: " + config.getOutputPath() + " ===");

        spark.stop();
    }

    private static Dataset<Row> readInput(SparkSession spark, ScoringConfig config) {
        switch (config.getInputFormat()) {
            case "csv":
                return spark.read()
                        .option("header", "true")
                        .option("inferSchema", "true")
                        .csv(config.getInputPath());
            case "json":
                return spark.read().json(config.getInputPath());
            default:
                return spark.read().parquet(config.getInputPath());
        }
    }
}
