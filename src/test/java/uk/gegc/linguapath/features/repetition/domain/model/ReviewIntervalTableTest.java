package uk.gegc.linguapath.features.repetition.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.linguapath.shared.exception.InvalidConfigurationException;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ReviewIntervalTable Tests")
class ReviewIntervalTableTest {

    @Test
    @DisplayName("defaults: strictly increasing in level for every band")
    void defaults_increaseWithLevel() {
        ReviewIntervalTable table = ReviewIntervalTable.defaults();

        for (IntervalBand band : IntervalBand.values()) {
            for (int level = 1; level < ReviewIntervalTable.LEVELS; level++) {
                assertThat(table.interval(level, band)).isGreaterThan(table.interval(level - 1, band));
            }
        }
    }

    @Test
    @DisplayName("defaults: LONG > MEDIUM > SHORT at every level and nothing exceeds 30 days")
    void defaults_bandsOrderedAndCapped() {
        ReviewIntervalTable table = ReviewIntervalTable.defaults();

        for (int level = 0; level < ReviewIntervalTable.LEVELS; level++) {
            assertThat(table.interval(level, IntervalBand.LONG)).isGreaterThan(table.interval(level, IntervalBand.MEDIUM));
            assertThat(table.interval(level, IntervalBand.MEDIUM)).isGreaterThan(table.interval(level, IntervalBand.SHORT));
            assertThat(table.interval(level, IntervalBand.LONG)).isLessThanOrEqualTo(ReviewIntervalTable.MAX_INTERVAL);
        }
        assertThat(table.interval(4, IntervalBand.LONG)).isEqualTo(Duration.ofDays(15));
    }

    @Test
    @DisplayName("of: rejects a band that does not increase with level")
    void of_nonIncreasingBand_throws() {
        Map<IntervalBand, List<Duration>> intervals = new EnumMap<>(ReviewIntervalTable.defaults().asMap());
        intervals.put(IntervalBand.SHORT, List.of(
                Duration.ofHours(1), Duration.ofHours(4), Duration.ofHours(4),
                Duration.ofHours(12), Duration.ofHours(18), Duration.ofDays(1)));

        assertThatThrownBy(() -> ReviewIntervalTable.of(intervals))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("SHORT");
    }

    @Test
    @DisplayName("of: rejects a MEDIUM interval that is not longer than SHORT at the same level")
    void of_bandsOutOfOrder_throws() {
        Map<IntervalBand, List<Duration>> intervals = new EnumMap<>(ReviewIntervalTable.defaults().asMap());
        intervals.put(IntervalBand.MEDIUM, List.of(
                Duration.ofMinutes(30), Duration.ofHours(12), Duration.ofDays(1),
                Duration.ofDays(2), Duration.ofDays(4), Duration.ofDays(7)));

        assertThatThrownBy(() -> ReviewIntervalTable.of(intervals))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("level 0");
    }

    @Test
    @DisplayName("of: rejects intervals longer than 30 days")
    void of_intervalTooLong_throws() {
        Map<IntervalBand, List<Duration>> intervals = new EnumMap<>(ReviewIntervalTable.defaults().asMap());
        intervals.put(IntervalBand.LONG, List.of(
                Duration.ofHours(12), Duration.ofDays(1), Duration.ofDays(3),
                Duration.ofDays(7), Duration.ofDays(15), Duration.ofDays(45)));

        assertThatThrownBy(() -> ReviewIntervalTable.of(intervals))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("exceeds");
    }

    @Test
    @DisplayName("of: rejects a band with the wrong number of levels")
    void of_wrongLength_throws() {
        Map<IntervalBand, List<Duration>> intervals = new EnumMap<>(ReviewIntervalTable.defaults().asMap());
        intervals.put(IntervalBand.LONG, List.of(Duration.ofDays(1), Duration.ofDays(2)));

        assertThatThrownBy(() -> ReviewIntervalTable.of(intervals))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("exactly 6");
    }

    @Test
    @DisplayName("of: rejects a missing band")
    void of_missingBand_throws() {
        Map<IntervalBand, List<Duration>> intervals = new EnumMap<>(ReviewIntervalTable.defaults().asMap());
        intervals.remove(IntervalBand.MEDIUM);

        assertThatThrownBy(() -> ReviewIntervalTable.of(intervals))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("MEDIUM");
    }
}
