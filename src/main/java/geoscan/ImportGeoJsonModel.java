package geoscan;

import geoscan.model.GeoscanModel;
import geoscan.model.GeoscanParams;
import geoscan.shape.GeoShape;
import org.apache.spark.sql.SparkSession;

import java.io.IOException;
import java.util.List;

/**
 * Packages a GeoJSON file of cluster polygons, as produced by a GEOSCAN
 * training run, into a saved {@link GeoscanModel}.
 */
public class ImportGeoJsonModel {

    public static void main(String[] args) throws IOException {

        if (args.length != 3) {
            System.err.println("Usage: ImportGeoJsonModel <clusters.geojson> <epsilon-metres> <model-path>");
            System.exit(1);
        }

        String inputPath = args[0];
        double epsilon = Double.parseDouble(args[1]);
        String modelPath = args[2];

        SparkSession spark = SparkSession.builder()
                .appName("ImportGeoJsonModel")
                .getOrCreate();

        spark.sparkContext().setLogLevel("WARN");

        System.out.println("\n=== Reading GeoJSON: " + inputPath + " ===");

        // whole file as one record, FeatureCollections are usually pretty-printed
        List<String> text = spark.read()
                .option("wholetext", "true")
                .textFile(inputPath)
                .collectAsList();
        if (text.size() != 1) {
            throw new IllegalArgumentException("Expected a single GeoJSON file at " + inputPath
                    + ", found " + text.size());
        }

        GeoShape shape = GeoShape.fromGeoJson(text.get(0));
        GeoscanModel model = new GeoscanModel(shape, GeoscanParams.builder().epsilon(epsilon).build());

        System.out.println("Cluster count = " + shape.size());
        System.out.println("H3 resolution = " + model.getPrecision());

        model.write(spark).save(modelPath);

        System.out.println("\n=== Wrote model " + model.getUid() + " to: " + modelPath + " ===");

        spark.stop();
    }
}
