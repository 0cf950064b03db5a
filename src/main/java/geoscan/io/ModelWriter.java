package geoscan.io;

import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.UUID;

/**
 * Saves a model to a directory.
 *
 * <p>
 * Subclasses write their artifacts in {@link #saveImpl(String)} into a hidden
 * staging directory next to the target. Only a staging directory that was
 * written completely is renamed onto the target, so a failed save never
 * leaves a half-written model behind. An existing target is an error unless
 * {@link #overwrite()} was called.
 * </p>
 */
public abstract class ModelWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ModelWriter.class);

    protected final SparkSession spark;
    private boolean shouldOverwrite = false;

    protected ModelWriter(SparkSession spark) {
        this.spark = Objects.requireNonNull(spark, "spark session must not be null");
    }

    /**
     * Replace the target directory if it already exists.
     */
    public ModelWriter overwrite() {
        this.shouldOverwrite = true;
        return this;
    }

    public boolean isOverwrite() {
        return shouldOverwrite;
    }

    /**
     * @throws IOException if the path exists and overwrite is off, or if
     *                     writing fails
     */
    public void save(String path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        Path target = new Path(path);
        FileSystem fs = ModelIO.fileSystem(spark, target);
        target = fs.makeQualified(target);

        if (fs.exists(target) && !shouldOverwrite) {
            throw new IOException("Path " + path + " already exists. "
                    + "To overwrite it, please use write().overwrite().save(path).");
        }
        Path parent = target.getParent();
        if (parent == null) {
            throw new IOException("Cannot save a model at the file system root: " + path);
        }

        Path staging = new Path(parent, "." + target.getName() + ".staging-" + UUID.randomUUID());
        try {
            saveImpl(staging.toString());
            if (fs.exists(target)) {
                LOG.info("Overwriting existing model at {}", target);
                if (!fs.delete(target, true)) {
                    throw new IOException("Failed to delete existing model at " + target);
                }
            }
            if (!fs.rename(staging, target)) {
                throw new IOException("Failed to move staged model " + staging + " to " + target);
            }
        } catch (Exception e) {
            // Spark raises AnalysisException and SparkException undeclared
            discard(fs, staging, e);
            if (e instanceof IOException) {
                throw (IOException) e;
            }
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new IOException("Failed to save model to " + path, e);
        }
        LOG.info("Saved model to {}", target);
    }

    /**
     * Write every artifact of the model under {@code path}.
     */
    protected abstract void saveImpl(String path) throws IOException;

    private static void discard(FileSystem fs, Path staging, Exception cause) {
        try {
            if (fs.exists(staging)) {
                fs.delete(staging, true);
            }
        } catch (IOException e) {
            LOG.warn("Could not remove staging directory {}", staging, e);
            cause.addSuppressed(e);
        }
    }
}
