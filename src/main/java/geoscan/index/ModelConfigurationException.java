package geoscan.index;

/**
 * Thrown when model parameters cannot be turned into a usable grid
 * configuration, for example an epsilon finer than the finest resolution.
 */
public class ModelConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ModelConfigurationException(String message) {
        super(message);
    }
}
