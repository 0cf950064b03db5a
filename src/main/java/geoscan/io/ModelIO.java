package geoscan.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.spark.sql.Encoders;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Reading and writing of the single-record text artifacts a model directory
 * is made of.
 */
public final class ModelIO {

    private static final Logger LOG = LoggerFactory.getLogger(ModelIO.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String METADATA = "metadata";
    public static final String DATA = "data";

    private ModelIO() {
    }

    public static void saveMetadata(SparkSession spark, String path, String className,
                                    String uid, Map<String, Object> paramMap) throws IOException {
        ModelMetadata metadata = new ModelMetadata(
                className, System.currentTimeMillis(), spark.version(), uid, paramMap);
        String json;
        try {
            json = MAPPER.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IOException("Failed to encode metadata for " + uid, e);
        }
        writeText(spark, new Path(path, METADATA).toString(), json);
    }

    /**
     * @param expectedClass class tag the metadata must carry
     */
    public static ModelMetadata loadMetadata(SparkSession spark, String path, String expectedClass)
            throws IOException {
        String metadataPath = new Path(path, METADATA).toString();
        String json = readSingleRecord(spark, metadataPath, METADATA);

        ModelMetadata metadata;
        try {
            metadata = MAPPER.readValue(json, ModelMetadata.class);
        } catch (JsonProcessingException e) {
            throw new CorruptModelException("Malformed model metadata at " + metadataPath, e);
        }
        if (metadata == null) {
            throw new CorruptModelException("Model metadata at " + metadataPath + " is not a JSON object");
        }
        if (!expectedClass.equals(metadata.getClassName())) {
            throw new CorruptModelException("Error loading metadata: expected class name "
                    + expectedClass + " but found class name " + metadata.getClassName());
        }
        if (metadata.getUid() == null || metadata.getUid().isBlank()) {
            throw new CorruptModelException("Model metadata at " + metadataPath + " has no uid");
        }
        if (metadata.getParamMap() == null) {
            throw new CorruptModelException("Model metadata at " + metadataPath + " has no paramMap");
        }
        return metadata;
    }

    /**
     * Write one text record as a single-part text file.
     */
    public static void writeText(SparkSession spark, String path, String text) {
        spark.createDataset(Collections.singletonList(text), Encoders.STRING())
                .coalesce(1)
                .write()
                .text(path);
    }

    /**
     * Read an artifact that must hold exactly one text record.
     *
     * @throws ModelNotFoundException if the artifact does not exist
     * @throws CorruptModelException  if it holds no record, or more than one
     */
    public static String readSingleRecord(SparkSession spark, String path, String artifact)
            throws IOException {
        requireExists(spark, path, artifact);
        List<String> records = spark.read().textFile(path).limit(2).collectAsList();
        if (records.isEmpty()) {
            throw new CorruptModelException("Model " + artifact + " at " + path + " is empty");
        }
        if (records.size() > 1) {
            throw new CorruptModelException(
                    "Model " + artifact + " at " + path + " must hold a single record");
        }
        LOG.debug("Read {} ({} chars) from {}", artifact, records.get(0).length(), path);
        return records.get(0);
    }

    public static FileSystem fileSystem(SparkSession spark, Path path) throws IOException {
        return path.getFileSystem(spark.sparkContext().hadoopConfiguration());
    }

    static void requireExists(SparkSession spark, String path, String artifact) throws IOException {
        Path p = new Path(path);
        if (!fileSystem(spark, p).exists(p)) {
            throw new ModelNotFoundException("Model " + artifact + " not found at " + path);
        }
    }
}
