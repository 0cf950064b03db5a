package geoscan.index;

import geoscan.shape.Cluster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expands cluster boundaries into the grid cells that cover them.
 *
 * <p>
 * A cell shared by several clusters yields one tile per cluster; use
 * {@link TileResolver} to settle such cells before joining.
 * </p>
 */
public final class TileExpander {

    private static final Logger LOG = LoggerFactory.getLogger(TileExpander.class);

    private final SpatialIndex index;

    public TileExpander(SpatialIndex index) {
        this.index = Objects.requireNonNull(index, "index must not be null");
    }

    /**
     * @param clusters  clusters to expand
     * @param precision grid resolution
     * @param layers    neighbour rings to add around each cluster, {@code >= 0}
     * @return tiles sorted by cluster id then cell id
     */
    public List<Tile> expand(Collection<Cluster> clusters, int precision, int layers) {
        Objects.requireNonNull(clusters, "clusters must not be null");
        if (layers < 0) {
            throw new IllegalArgumentException("layers must be >= 0, got: " + layers);
        }

        List<Tile> tiles = clusters.parallelStream()
                .flatMap(cluster -> {
                    var cells = index.polyFill(cluster.getPoints(), precision, layers);
                    LOG.debug("Cluster {} covers {} cell(s) at resolution {}",
                            cluster.getId(), cells.size(), precision);
                    return cells.stream().map(cell -> new Tile(cluster.getId(), cell));
                })
                .sorted(Tile.ORDER)
                .collect(Collectors.toList());

        LOG.info("Expanded {} cluster(s) into {} tile(s) at resolution {} with {} layer(s)",
                clusters.size(), tiles.size(), precision, layers);
        return tiles;
    }
}
