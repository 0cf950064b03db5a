package geoscan.io;

import java.io.FileNotFoundException;

/**
 * Thrown when a model directory, or one of its artifacts, does not exist.
 */
public class ModelNotFoundException extends FileNotFoundException {

    private static final long serialVersionUID = 1L;

    public ModelNotFoundException(String message) {
        super(message);
    }
}
