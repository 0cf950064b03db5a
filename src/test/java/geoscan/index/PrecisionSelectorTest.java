package geoscan.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PrecisionSelector} against the real H3 grid.
 */
class PrecisionSelectorTest {

    private final H3SpatialIndex h3 = H3SpatialIndex.instance();
    private final PrecisionSelector selector = new PrecisionSelector(h3);

    @ParameterizedTest
    @ValueSource(doubles = {5.0, 50.0, 100.0, 1_000.0, 25_000.0, 1_000_000.0})
    @DisplayName("Should pick the coarsest resolution whose cell diagonal fits epsilon")
    void shouldPickCoarsestFittingResolution(double epsilon) {
        int res = selector.selectPrecision(epsilon);

        assertThat(2 * h3.edgeLengthMeters(res)).isLessThanOrEqualTo(epsilon);
        if (res > h3.minPrecision()) {
            assertThat(2 * h3.edgeLengthMeters(res - 1)).isGreaterThan(epsilon);
        }
    }

    @Test
    @DisplayName("Should return resolution 0 for continental epsilon")
    void shouldReturnCoarsestForHugeEpsilon() {
        assertThat(selector.selectPrecision(1e9)).isZero();
    }

    @Test
    @DisplayName("Should never pick a coarser resolution for a smaller epsilon")
    void shouldBeMonotonic() {
        assertThat(selector.selectPrecision(100.0)).isGreaterThanOrEqualTo(selector.selectPrecision(1_000.0));
        assertThat(selector.selectPrecision(1_000.0)).isGreaterThanOrEqualTo(selector.selectPrecision(10_000.0));
    }

    @Test
    @DisplayName("Should fail when epsilon is finer than the finest resolution")
    void shouldFailForTinyEpsilon() {
        assertThatThrownBy(() -> selector.selectPrecision(0.1))
                .isInstanceOf(ModelConfigurationException.class)
                .hasMessageContaining("Could not infer precision");
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -10.0, Double.NaN, Double.POSITIVE_INFINITY})
    @DisplayName("Should fail for non-positive or non-finite epsilon")
    void shouldFailForInvalidEpsilon(double epsilon) {
        assertThatThrownBy(() -> selector.selectPrecision(epsilon))
                .isInstanceOf(ModelConfigurationException.class)
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should follow the edge lengths of the supplied index")
    void shouldUseSuppliedIndex() {
        PrecisionSelector fake = new PrecisionSelector(new FakeSpatialIndex());

        // fake diagonals: 2000, 1000, 500, 250
        assertThat(fake.selectPrecision(5_000)).isZero();
        assertThat(fake.selectPrecision(600)).isEqualTo(2);
        assertThat(fake.selectPrecision(250)).isEqualTo(3);
        assertThatThrownBy(() -> fake.selectPrecision(200)).isInstanceOf(ModelConfigurationException.class);
    }
}
