package geoscan.config;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Typed, immutable configuration of the batch scoring driver.
 *
 * <p>
 * Values are resolved from environment variables with defaults by
 * {@link #fromEnvironment()}, or set programmatically through the
 * {@link Builder}, which validates at {@link Builder#build()} time.
 * </p>
 */
public final class ScoringConfig {

    public static final Set<String> INPUT_FORMATS = Set.of("parquet", "csv", "json");
    public static final Set<String> OUTPUT_MODES = Set.of("overwrite", "errorifexists");

    private final String appName;
    private final String modelPath;
    private final String inputPath;
    private final String outputPath;
    private final String inputFormat;
    private final String outputMode;

    private ScoringConfig(Builder b) {
        this.appName = b.appName;
        this.modelPath = b.modelPath;
        this.inputPath = b.inputPath;
        this.outputPath = b.outputPath;
        this.inputFormat = b.inputFormat;
        this.outputMode = b.outputMode;
    }

    /**
     * @return a builder populated from {@code GEOSCAN_*} environment variables
     */
    public static Builder fromEnvironment() {
        return new Builder()
                .appName(env("GEOSCAN_APP_NAME", "GeoscanScoring"))
                .modelPath(env("GEOSCAN_MODEL_PATH", ""))
                .inputPath(env("GEOSCAN_INPUT_PATH", ""))
                .outputPath(env("GEOSCAN_OUTPUT_PATH", ""))
                .inputFormat(env("GEOSCAN_INPUT_FORMAT", "parquet"))
                .outputMode(env("GEOSCAN_OUTPUT_MODE", "overwrite"));
    }

    public String getAppName() {
        return appName;
    }

    public String getModelPath() {
        return modelPath;
    }

    public String getInputPath() {
        return inputPath;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public String getInputFormat() {
        return inputFormat;
    }

    public String getOutputMode() {
        return outputMode;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private String appName = "GeoscanScoring";
        private String modelPath = "";
        private String inputPath = "";
        private String outputPath = "";
        private String inputFormat = "parquet";
        private String outputMode = "overwrite";

        public Builder appName(String v) {
            this.appName = v;
            return this;
        }

        public Builder modelPath(String v) {
            this.modelPath = v;
            return this;
        }

        public Builder inputPath(String v) {
            this.inputPath = v;
            return this;
        }

        public Builder outputPath(String v) {
            this.outputPath = v;
            return this;
        }

        public Builder inputFormat(String v) {
            this.inputFormat = v == null ? null : v.toLowerCase(Locale.ROOT);
            return this;
        }

        public Builder outputMode(String v) {
            this.outputMode = v == null ? null : v.toLowerCase(Locale.ROOT);
            return this;
        }

        /**
         * @throws IllegalArgumentException if a path is missing or a format
         *                                  or mode is not supported
         */
        public ScoringConfig build() {
            requireNonBlank(appName, "appName");
            requireNonBlank(modelPath, "modelPath (GEOSCAN_MODEL_PATH)");
            requireNonBlank(inputPath, "inputPath (GEOSCAN_INPUT_PATH)");
            requireNonBlank(outputPath, "outputPath (GEOSCAN_OUTPUT_PATH)");
            Objects.requireNonNull(inputFormat, "inputFormat required");
            Objects.requireNonNull(outputMode, "outputMode required");
            if (!INPUT_FORMATS.contains(inputFormat)) {
                throw new IllegalArgumentException(
                        "Unsupported input format '" + inputFormat + "'. Supported: parquet, csv, json");
            }
            if (!OUTPUT_MODES.contains(outputMode)) {
                throw new IllegalArgumentException(
                        "Unsupported output mode '" + outputMode + "'. Supported: overwrite, errorifexists");
            }
            return new ScoringConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ScoringConfig{" +
                "appName='" + appName + '\'' +
                ", modelPath='" + modelPath + '\'' +
                ", inputPath='" + inputPath + '\'' +
                ", outputPath='" + outputPath + '\'' +
                ", inputFormat='" + inputFormat + '\'' +
                ", outputMode='" + outputMode + '\'' +
                '}';
    }
}
