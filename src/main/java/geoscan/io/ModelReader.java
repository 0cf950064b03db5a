package geoscan.io;

import java.io.IOException;

/**
 * Loads a model saved by the matching {@link ModelWriter}.
 *
 * @param <M> model type
 */
public interface ModelReader<M> {

    /**
     * @throws ModelNotFoundException if the model or one of its artifacts is missing
     * @throws CorruptModelException  if an artifact cannot be decoded
     * @throws IOException            on any other storage failure
     */
    M load(String path) throws IOException;
}
