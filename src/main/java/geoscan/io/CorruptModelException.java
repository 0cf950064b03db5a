package geoscan.io;

import java.io.IOException;

/**
 * Thrown when a persisted model exists but cannot be read back: an empty or
 * multi-record artifact, malformed JSON, or values that fail validation.
 */
public class CorruptModelException extends IOException {

    private static final long serialVersionUID = 1L;

    public CorruptModelException(String message) {
        super(message);
    }

    public CorruptModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
