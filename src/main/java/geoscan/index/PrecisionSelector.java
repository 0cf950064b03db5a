package geoscan.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Derives a grid resolution from the GEOSCAN distance scale.
 *
 * <p>
 * The selected resolution is the coarsest one whose cell diagonal, taken as
 * twice the average edge length, does not exceed epsilon. Tile expansion and
 * point lookup must use the same value, otherwise no cell ever matches.
 * </p>
 */
public final class PrecisionSelector {

    private static final Logger LOG = LoggerFactory.getLogger(PrecisionSelector.class);

    private final SpatialIndex index;

    public PrecisionSelector(SpatialIndex index) {
        this.index = Objects.requireNonNull(index, "index must not be null");
    }

    /**
     * @param epsilon distance scale in metres
     * @return the coarsest resolution fine enough for {@code epsilon}
     * @throws ModelConfigurationException if epsilon is not a positive finite
     *                                     number or no resolution is fine enough
     */
    public int selectPrecision(double epsilon) {
        if (!Double.isFinite(epsilon) || epsilon <= 0) {
            throw new ModelConfigurationException(
                    "epsilon must be a positive finite distance, got: " + epsilon);
        }
        for (int res = index.minPrecision(); res <= index.maxPrecision(); res++) {
            double diagonal = 2.0 * index.edgeLengthMeters(res);
            if (diagonal <= epsilon) {
                LOG.debug("epsilon {}m -> resolution {} (cell diagonal {}m)", epsilon, res, diagonal);
                return res;
            }
        }
        throw new ModelConfigurationException(
                "Could not infer precision from epsilon value " + epsilon
                        + "m: finest cell diagonal is "
                        + 2.0 * index.edgeLengthMeters(index.maxPrecision()) + "m");
    }
}
