package uk.gegc.linguapath.features.assessment.domain.model;

import java.util.List;

public enum Trend {
    UP,
    DOWN,
    STABLE;

    static final int WINDOW = 3;
    static final double THRESHOLD = 2.0;

    /**
     * Compares the mean of the last three accuracies with the mean of the three before them.
     *
     * @param chronological graded accuracies, oldest first
     */
    public static Trend of(List<Double> chronological) {
        if (chronological == null || chronological.size() < 2 * WINDOW) {
            return STABLE;
        }
        int size = chronological.size();
        double recent = mean(chronological.subList(size - WINDOW, size));
        double previous = mean(chronological.subList(size - 2 * WINDOW, size - WINDOW));
        double difference = recent - previous;
        if (difference > THRESHOLD) return UP;
        if (difference < -THRESHOLD) return DOWN;
        return STABLE;
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
