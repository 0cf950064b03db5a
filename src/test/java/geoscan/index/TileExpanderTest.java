package geoscan.index;

import geoscan.shape.Cluster;
import geoscan.shape.GeoPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TileExpander}.
 */
class TileExpanderTest {

    private static final int RES = 8;

    private static final Cluster MISSION = new Cluster("mission", List.of(
            GeoPoint.of(37.750, -122.425), GeoPoint.of(37.750, -122.405),
            GeoPoint.of(37.765, -122.405), GeoPoint.of(37.765, -122.425)));

    private static final Cluster MARINA = new Cluster("marina", List.of(
            GeoPoint.of(37.798, -122.445), GeoPoint.of(37.798, -122.430),
            GeoPoint.of(37.806, -122.430), GeoPoint.of(37.806, -122.445),
            GeoPoint.of(37.798, -122.445)));

    private final TileExpander expander = new TileExpander(H3SpatialIndex.instance());

    @Test
    @DisplayName("Should emit one tile per covered cell, sorted by cluster then cell")
    void shouldExpandClusters() {
        List<Tile> tiles = expander.expand(List.of(MISSION, MARINA), RES, 0);

        assertThat(tiles).isNotEmpty();
        assertThat(tiles).isSortedAccordingTo(Tile.ORDER);
        assertThat(tiles).doesNotHaveDuplicates();
        assertThat(tiles).extracting(Tile::clusterId).containsOnly("mission", "marina");
        assertThat(tiles.get(0).clusterId()).isEqualTo("marina");
    }

    @Test
    @DisplayName("Should grow the cell set when layers are added")
    void shouldProduceSupersetWithLayers() {
        Set<Tile> exact = Set.copyOf(expander.expand(List.of(MISSION), RES, 0));
        Set<Tile> dilated = Set.copyOf(expander.expand(List.of(MISSION), RES, 1));

        assertThat(dilated).containsAll(exact);
        assertThat(dilated.size()).isGreaterThan(exact.size());
    }

    @Test
    @DisplayName("Should keep shared cells once per cluster")
    void shouldKeepCrossClusterDuplicates() {
        Cluster twin = new Cluster("twin", MISSION.getPoints());

        List<Tile> tiles = expander.expand(List.of(MISSION, twin), RES, 0);

        Set<String> missionCells = tiles.stream().filter(t -> t.clusterId().equals("mission"))
                .map(Tile::cellId).collect(Collectors.toSet());
        Set<String> twinCells = tiles.stream().filter(t -> t.clusterId().equals("twin"))
                .map(Tile::cellId).collect(Collectors.toSet());
        assertThat(twinCells).isEqualTo(missionCells);
    }

    @Test
    @DisplayName("Should return no tiles for no clusters")
    void shouldHandleEmptyInput() {
        assertThat(expander.expand(List.of(), RES, 2)).isEmpty();
    }

    @Test
    @DisplayName("Should reject negative layers")
    void shouldRejectNegativeLayers() {
        assertThatThrownBy(() -> expander.expand(List.of(MISSION), RES, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("layers");
    }

    @Test
    @DisplayName("Should delegate cell coverage to the spatial index")
    void shouldUseSuppliedIndex() {
        FakeSpatialIndex fake = new FakeSpatialIndex()
                .boundary(MISSION.getPoints(), "1A", "1B")
                .neighbours("1A", "1C");

        assertThat(new TileExpander(fake).expand(List.of(MISSION), 0, 0))
                .containsExactly(new Tile("mission", "1A"), new Tile("mission", "1B"));
        assertThat(new TileExpander(fake).expand(List.of(MISSION), 0, 1))
                .containsExactly(new Tile("mission", "1A"), new Tile("mission", "1B"), new Tile("mission", "1C"));
    }
}
