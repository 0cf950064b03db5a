package geoscan.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Contents of the {@code metadata} artifact: what was saved, when, and with
 * which parameters. Field names follow Spark ML's own metadata files.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelMetadata {

    @JsonProperty("class")
    private String className;
    private long timestamp;
    private String sparkVersion;
    private String uid;
    private Map<String, Object> paramMap = new LinkedHashMap<>();

    public ModelMetadata() {
    }

    public ModelMetadata(String className, long timestamp, String sparkVersion,
                         String uid, Map<String, Object> paramMap) {
        this.className = className;
        this.timestamp = timestamp;
        this.sparkVersion = sparkVersion;
        this.uid = uid;
        this.paramMap = new LinkedHashMap<>(paramMap);
    }

    public String getClassName() {
        return className;
    }

    public void setClassName(String className) {
        this.className = className;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public String getSparkVersion() {
        return sparkVersion;
    }

    public void setSparkVersion(String sparkVersion) {
        this.sparkVersion = sparkVersion;
    }

    public String getUid() {
        return uid;
    }

    public void setUid(String uid) {
        this.uid = uid;
    }

    public Map<String, Object> getParamMap() {
        return paramMap;
    }

    public void setParamMap(Map<String, Object> paramMap) {
        this.paramMap = paramMap;
    }

    @Override
    public String toString() {
        return "ModelMetadata{" +
                "class='" + className + '\'' +
                ", timestamp=" + timestamp +
                ", sparkVersion='" + sparkVersion + '\'' +
                ", uid='" + uid + '\'' +
                ", paramMap=" + paramMap +
                '}';
    }
}
