package uk.gegc.linguapath.features.repetition.domain.model;

import uk.gegc.linguapath.shared.exception.InvalidConfigurationException;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Review intervals per mastery level and band. Instances are only created through
 * {@link #of(Map)}, which rejects tables that would schedule a better answer sooner
 * than a worse one.
 */
public final class ReviewIntervalTable {

    public static final Duration MAX_INTERVAL = Duration.ofDays(30);
    public static final int LEVELS = VocabularyEntry.MAX_MASTERY + 1;

    private final Map<IntervalBand, List<Duration>> intervals;

    private ReviewIntervalTable(Map<IntervalBand, List<Duration>> intervals) {
        this.intervals = intervals;
    }

    public static ReviewIntervalTable defaults() {
        Map<IntervalBand, List<Duration>> intervals = new EnumMap<>(IntervalBand.class);
        intervals.put(IntervalBand.SHORT, List.of(
                Duration.ofHours(1), Duration.ofHours(4), Duration.ofHours(8),
                Duration.ofHours(12), Duration.ofHours(18), Duration.ofDays(1)));
        intervals.put(IntervalBand.MEDIUM, List.of(
                Duration.ofHours(2), Duration.ofHours(12), Duration.ofDays(1),
                Duration.ofDays(2), Duration.ofDays(4), Duration.ofDays(7)));
        intervals.put(IntervalBand.LONG, List.of(
                Duration.ofHours(12), Duration.ofDays(1), Duration.ofDays(3),
                Duration.ofDays(7), Duration.ofDays(15), Duration.ofDays(30)));
        return of(intervals);
    }

    /**
     * Validates and freezes a table.
     *
     * @throws InvalidConfigurationException when a band is missing or has the wrong length, an interval is
     *                                       not positive or exceeds {@link #MAX_INTERVAL}, a band does not
     *                                       strictly increase with level, or bands are not ordered
     *                                       SHORT &lt; MEDIUM &lt; LONG at some level
     */
    public static ReviewIntervalTable of(Map<IntervalBand, List<Duration>> source) {
        if (source == null) {
            throw new InvalidConfigurationException("Review interval table is missing");
        }
        Map<IntervalBand, List<Duration>> copy = new EnumMap<>(IntervalBand.class);
        for (IntervalBand band : IntervalBand.values()) {
            List<Duration> row = source.get(band);
            if (row == null || row.size() != LEVELS) {
                throw new InvalidConfigurationException("Band " + band + " must define exactly " + LEVELS
                        + " intervals, one per mastery level");
            }
            for (int level = 0; level < LEVELS; level++) {
                Duration interval = row.get(level);
                if (interval == null || interval.isZero() || interval.isNegative()) {
                    throw new InvalidConfigurationException("Interval for " + band + " level " + level + " must be positive");
                }
                if (interval.compareTo(MAX_INTERVAL) > 0) {
                    throw new InvalidConfigurationException("Interval for " + band + " level " + level
                            + " exceeds " + MAX_INTERVAL.toDays() + " days");
                }
                if (level > 0 && interval.compareTo(row.get(level - 1)) <= 0) {
                    throw new InvalidConfigurationException("Intervals for " + band + " must increase with mastery level"
                            + " (level " + level + " is not longer than level " + (level - 1) + ")");
                }
            }
            copy.put(band, List.copyOf(row));
        }
        for (int level = 0; level < LEVELS; level++) {
            Duration shortInterval = copy.get(IntervalBand.SHORT).get(level);
            Duration mediumInterval = copy.get(IntervalBand.MEDIUM).get(level);
            Duration longInterval = copy.get(IntervalBand.LONG).get(level);
            if (mediumInterval.compareTo(shortInterval) <= 0 || longInterval.compareTo(mediumInterval) <= 0) {
                throw new InvalidConfigurationException("Bands must satisfy SHORT < MEDIUM < LONG at level " + level);
            }
        }
        return new ReviewIntervalTable(Collections.unmodifiableMap(copy));
    }

    /**
     * @param masteryLevel level in [0, 5]
     */
    public Duration interval(int masteryLevel, IntervalBand band) {
        if (masteryLevel < 0 || masteryLevel >= LEVELS) {
            throw new IllegalArgumentException("Mastery level out of range: " + masteryLevel);
        }
        return intervals.get(band).get(masteryLevel);
    }

    public Map<IntervalBand, List<Duration>> asMap() {
        return intervals;
    }
}
