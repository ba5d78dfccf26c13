package rollingplan.geometry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DistanceStatisticsTest {

    private static VisibilityWindow window(int index) {
        Instant t = Instant.parse("2025-07-01T00:00:00Z").plusSeconds(60L * index);
        return new VisibilityWindow(index, index, t, t, 100.0);
    }

    @Test
    @DisplayName("confidence is zero for empty input")
    void emptyInputHasZeroConfidence() {
        assertEquals(0.0, DistanceStatistics.confidence(Collections.emptyList(), Collections.emptyList()));
        assertEquals(0.0, DistanceStatistics.confidence(null, null));
    }

    @Test
    void stableDistancesWithThreeWindowsGiveFullConfidence() {
        List<Double> distances = Arrays.asList(500.0, 500.0, 500.0);
        List<VisibilityWindow> windows = Arrays.asList(window(0), window(1), window(2));
        assertEquals(1.0, DistanceStatistics.confidence(distances, windows), 1e-12);
    }

    @Test
    void stableDistancesWithoutWindowsGiveHalfConfidence() {
        List<Double> distances = Arrays.asList(800.0, 800.0);
        assertEquals(0.5, DistanceStatistics.confidence(distances, Collections.emptyList()), 1e-12);
    }

    @Test
    void coverageSaturatesAtThreeWindows() {
        List<Double> distances = Collections.singletonList(10.0);
        List<VisibilityWindow> five = Arrays.asList(window(0), window(1), window(2), window(3), window(4));
        assertEquals(1.0, DistanceStatistics.confidence(distances, five), 1e-12);
    }

    @Test
    void largeVarianceRemovesStability() {
        // 方差 = 4e6 > 1e6
        List<Double> distances = Arrays.asList(0.0, 4000.0);
        List<VisibilityWindow> one = Collections.singletonList(window(0));
        assertEquals(1.0 / 6.0, DistanceStatistics.confidence(distances, one), 1e-12);
    }

    @Test
    void nonFiniteDistancesRemoveStability() {
        List<Double> distances = Arrays.asList(100.0, Double.POSITIVE_INFINITY);
        assertEquals(0.0, DistanceStatistics.confidence(distances, Collections.emptyList()), 1e-12);
    }

    @Test
    void varianceIsPopulationVariance() {
        assertEquals(1.0, DistanceStatistics.variance(Arrays.asList(1.0, 3.0)), 1e-12);
        assertEquals(2.0, DistanceStatistics.mean(Arrays.asList(1.0, 3.0)), 1e-12);
        assertEquals(Double.POSITIVE_INFINITY, DistanceStatistics.mean(Collections.emptyList()));
    }
}
