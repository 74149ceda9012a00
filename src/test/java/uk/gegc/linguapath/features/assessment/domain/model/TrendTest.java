package uk.gegc.linguapath.features.assessment.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Trend Tests")
class TrendTest {

    @Test
    @DisplayName("Fewer than six accuracies is stable")
    void tooFewValues_isStable() {
        assertEquals(Trend.STABLE, Trend.of(null));
        assertEquals(Trend.STABLE, Trend.of(List.of()));
        assertEquals(Trend.STABLE, Trend.of(List.of(10.0, 20.0, 30.0, 90.0, 95.0)));
    }

    @Test
    @DisplayName("Recent mean more than two points higher is up")
    void risingMean_isUp() {
        assertEquals(Trend.UP, Trend.of(List.of(50.0, 50.0, 50.0, 55.0, 55.0, 55.0)));
    }

    @Test
    @DisplayName("Recent mean more than two points lower is down")
    void fallingMean_isDown() {
        assertEquals(Trend.DOWN, Trend.of(List.of(60.0, 60.0, 60.0, 57.0, 58.0, 58.0)));
    }

    @Test
    @DisplayName("A difference of exactly two points is stable")
    void boundaryDifference_isStable() {
        assertEquals(Trend.STABLE, Trend.of(List.of(50.0, 50.0, 50.0, 52.0, 52.0, 52.0)));
        assertEquals(Trend.STABLE, Trend.of(List.of(52.0, 52.0, 52.0, 50.0, 50.0, 50.0)));
    }

    @Test
    @DisplayName("Only the last six accuracies are compared")
    void olderValues_areIgnored() {
        assertEquals(Trend.UP, Trend.of(List.of(100.0, 100.0, 100.0, 50.0, 50.0, 50.0, 55.0, 55.0, 55.0)));
    }
}
