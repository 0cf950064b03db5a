package geoscan.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import geoscan.LocalSpark;
import geoscan.model.GeoscanModel;
import geoscan.model.GeoscanParams;
import geoscan.shape.Cluster;
import geoscan.shape.GeoPoint;
import geoscan.shape.GeoShape;
import org.apache.spark.sql.SparkSession;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Save / load tests for {@link GeoscanModelWriter} and {@link GeoscanModelReader}.
 */
class GeoscanModelPersistenceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static SparkSession spark;

    @TempDir
    Path tmp;

    @BeforeAll
    static void startSpark() {
        spark = LocalSpark.session();
    }

    @Test
    @DisplayName("Should load back the same uid, params and shape")
    void shouldRoundTrip() throws IOException {
        GeoscanModel model = sampleModel();
        String path = tmp.resolve("model").toString();

        model.write(spark).save(path);
        GeoscanModel loaded = GeoscanModel.load(spark, path);

        assertThat(loaded.getUid()).isEqualTo(model.getUid());
        assertThat(loaded.getParams()).isEqualTo(model.getParams());
        assertThat(loaded.getShape()).isEqualTo(model.getShape());
        assertThat(loaded.getShape().getClusters().get(1).getPoints())
                .containsExactlyElementsOf(model.getShape().getClusters().get(1).getPoints());
    }

    @Test
    @DisplayName("Should save and load a model without clusters")
    void shouldRoundTripEmptyShape() throws IOException {
        GeoscanModel model = new GeoscanModel("empty-uid", GeoShape.empty(),
                GeoscanParams.builder().epsilon(50).build());
        String path = tmp.resolve("empty").toString();

        model.save(spark, path);
        GeoscanModel loaded = GeoscanModel.read(spark).load(path);

        assertThat(loaded.getShape().getClusters()).isEmpty();
        assertThat(loaded.getUid()).isEqualTo("empty-uid");
    }

    @Test
    @DisplayName("Should write Spark-style metadata and a single GeoJSON record")
    void shouldWriteArtifactLayout() throws IOException {
        GeoscanModel model = sampleModel();
        Path path = tmp.resolve("layout");

        model.write(spark).save(path.toString());

        JsonNode metadata = MAPPER.readTree(readPart(path.resolve("metadata")));
        assertThat(metadata.path("class").asText()).isEqualTo(GeoscanModel.class.getName());
        assertThat(metadata.path("uid").asText()).isEqualTo("geoscan-test-uid");
        assertThat(metadata.path("sparkVersion").asText()).isEqualTo(spark.version());
        assertThat(metadata.path("timestamp").asLong()).isPositive();
        assertThat(metadata.path("paramMap").path("epsilon").asDouble()).isEqualTo(250.0);
        assertThat(metadata.path("paramMap").path("predictionCol").asText()).isEqualTo("zone");

        String data = readPart(path.resolve("data"));
        assertThat(data.trim()).isEqualTo(model.toGeoJson());
    }

    @Test
    @DisplayName("Should refuse to save over an existing path unless asked to overwrite")
    void shouldApplyOverwritePolicy() throws IOException {
        String path = tmp.resolve("model").toString();
        sampleModel().write(spark).save(path);
        GeoscanModel other = new GeoscanModel("other-uid", GeoShape.empty(),
                GeoscanParams.builder().epsilon(75).build());

        assertThatThrownBy(() -> other.write(spark).save(path))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("already exists");
        assertThat(GeoscanModel.load(spark, path).getUid()).isEqualTo("geoscan-test-uid");

        other.write(spark).overwrite().save(path);
        assertThat(GeoscanModel.load(spark, path).getUid()).isEqualTo("other-uid");
    }

    @Test
    @DisplayName("Should leave no staging directory behind")
    void shouldCleanUpStaging() throws IOException {
        sampleModel().write(spark).save(tmp.resolve("model").toString());

        try (Stream<Path> entries = Files.list(tmp)) {
            assertThat(entries.map(p -> p.getFileName().toString()).collect(Collectors.toList()))
                    .containsExactly("model");
        }
    }

    @Test
    @DisplayName("Should report a missing model directory as not found")
    void shouldFailForMissingModel() {
        assertThatThrownBy(() -> GeoscanModel.load(spark, tmp.resolve("nothing").toString()))
                .isInstanceOf(ModelNotFoundException.class)
                .isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Should report a missing data artifact as not found")
    void shouldFailForMissingData() throws IOException {
        Path path = savedModel();
        deleteRecursively(path.resolve("data"));

        assertThatThrownBy(() -> GeoscanModel.load(spark, path.toString()))
                .isInstanceOf(ModelNotFoundException.class)
                .hasMessageContaining("data");
    }

    @Test
    @DisplayName("Should report a missing metadata artifact as not found")
    void shouldFailForMissingMetadata() throws IOException {
        Path path = savedModel();
        deleteRecursively(path.resolve("metadata"));

        assertThatThrownBy(() -> GeoscanModel.load(spark, path.toString()))
                .isInstanceOf(ModelNotFoundException.class)
                .hasMessageContaining("metadata");
    }

    @Test
    @DisplayName("Should reject a data artifact with no record")
    void shouldFailForEmptyData() throws IOException {
        Path path = savedModel();
        replacePart(path.resolve("data"), "");

        assertThatThrownBy(() -> GeoscanModel.load(spark, path.toString()))
                .isInstanceOf(CorruptModelException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("Should reject a data artifact with more than one record")
    void shouldFailForMultipleRecords() throws IOException {
        Path path = savedModel();
        replacePart(path.resolve("data"), GeoShape.empty().toGeoJson() + "\n" + GeoShape.empty().toGeoJson() + "\n");

        assertThatThrownBy(() -> GeoscanModel.load(spark, path.toString()))
                .isInstanceOf(CorruptModelException.class)
                .hasMessageContaining("single record");
    }

    @Test
    @DisplayName("Should reject malformed GeoJSON data")
    void shouldFailForMalformedData() throws IOException {
        Path path = savedModel();
        replacePart(path.resolve("data"), "{\"type\":\"FeatureCollection\",\"features\":\n");

        assertThatThrownBy(() -> GeoscanModel.load(spark, path.toString()))
                .isInstanceOf(CorruptModelException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject metadata written for another model class")
    void shouldFailForWrongClassTag() throws IOException {
        Path path = savedModel();
        replacePart(path.resolve("metadata"),
                "{\"class\":\"org.example.OtherModel\",\"uid\":\"x\",\"paramMap\":{\"epsilon\":1.0}}\n");

        assertThatThrownBy(() -> GeoscanModel.load(spark, path.toString()))
                .isInstanceOf(CorruptModelException.class)
                .hasMessageContaining("org.example.OtherModel");
    }

    @Test
    @DisplayName("Should reject metadata that is a JSON null")
    void shouldFailForNullMetadata() throws IOException {
        Path path = savedModel();
        replacePart(path.resolve("metadata"), "null\n");

        assertThatThrownBy(() -> GeoscanModel.load(spark, path.toString()))
                .isInstanceOf(CorruptModelException.class)
                .hasMessageContaining("metadata");
    }

    @Test
    @DisplayName("Should reject data with content after the GeoJSON object")
    void shouldFailForTrailingData() throws IOException {
        Path path = savedModel();
        replacePart(path.resolve("data"), GeoShape.empty().toGeoJson() + "garbage\n");

        assertThatThrownBy(() -> GeoscanModel.load(spark, path.toString()))
                .isInstanceOf(CorruptModelException.class)
                .hasMessageContaining("Malformed model data");
    }

    @Test
    @DisplayName("Should reject metadata with invalid parameters")
    void shouldFailForInvalidParams() throws IOException {
        Path path = savedModel();
        replacePart(path.resolve("metadata"), "{\"class\":\"" + GeoscanModel.class.getName()
                + "\",\"uid\":\"x\",\"paramMap\":{\"epsilon\":-3.0}}\n");

        assertThatThrownBy(() -> GeoscanModel.load(spark, path.toString()))
                .isInstanceOf(CorruptModelException.class)
                .hasMessageContaining("Invalid parameters");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static GeoscanModel sampleModel() {
        GeoShape shape = new GeoShape(List.of(
                new Cluster("mission", List.of(
                        GeoPoint.of(37.750, -122.425), GeoPoint.of(37.750, -122.405),
                        GeoPoint.of(37.765, -122.405), GeoPoint.of(37.765, -122.425))),
                new Cluster("17", List.of(
                        GeoPoint.of(37.80000000000001, -122.44512345678901),
                        GeoPoint.of(37.798, -122.430), GeoPoint.of(37.806, -122.430),
                        GeoPoint.of(37.80000000000001, -122.44512345678901)))));
        GeoscanParams params = GeoscanParams.builder()
                .epsilon(250.0)
                .latitudeCol("lat")
                .longitudeCol("lng")
                .predictionCol("zone")
                .layers(1)
                .build();
        return new GeoscanModel("geoscan-test-uid", shape, params);
    }

    private Path savedModel() throws IOException {
        Path path = tmp.resolve("model");
        sampleModel().write(spark).save(path.toString());
        return path;
    }

    private static String readPart(Path artifact) throws IOException {
        try (Stream<Path> files = Files.list(artifact)) {
            Path part = files
                    .filter(p -> p.getFileName().toString().startsWith("part-"))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No part file in " + artifact));
            return Files.readString(part);
        }
    }

    private static void replacePart(Path artifact, String content) throws IOException {
        deleteRecursively(artifact);
        Files.createDirectories(artifact);
        Files.writeString(artifact.resolve("part-00000"), content);
    }

    private static void deleteRecursively(Path path) throws IOException {
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(p);
            }
        }
    }
}
