package geoscan.index;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;

/**
 * Association between a cluster and one grid cell it covers.
 */
public record Tile(String clusterId, String cellId) implements Serializable {

    public static final Comparator<Tile> ORDER =
            Comparator.comparing(Tile::clusterId).thenComparing(Tile::cellId);

    public Tile {
        Objects.requireNonNull(clusterId, "clusterId must not be null");
        Objects.requireNonNull(cellId, "cellId must not be null");
    }
}
