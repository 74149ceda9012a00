package uk.gegc.linguapath.features.activity.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Schema(name = "ActivityAggregate", description = "Accuracy and time statistics over a window of activity records")
public record ActivityAggregate(
        @Schema(description = "Total seconds spent")
        long totalTimeSpent,
        @Schema(description = "Number of graded attempts")
        int totalAttempts,
        @Schema(description = "Graded attempts at or above the correct threshold")
        int correctAttempts,
        @Schema(description = "Mean accuracy of graded attempts, 0 when there are none")
        double averageAccuracy,
        @Schema(description = "Consecutive calendar days with activity, counted back from today")
        int streakDays,
        @Schema(description = "Number of records per activity type")
        Map<ActivityType, Integer> countsByModule,
        @Schema(description = "Graded accuracies ordered oldest first")
        List<Double> gradedAccuracies
) {

    public ActivityAggregate {
        Map<ActivityType, Integer> counts = zeroCounts();
        if (countsByModule != null) {
            counts.putAll(countsByModule);
        }
        countsByModule = Collections.unmodifiableMap(counts);
        gradedAccuracies = gradedAccuracies == null ? List.of() : List.copyOf(gradedAccuracies);
    }

    public static ActivityAggregate empty() {
        return new ActivityAggregate(0L, 0, 0, 0.0, 0, zeroCounts(), List.of());
    }

    /**
     * Aggregate that only carries accuracy and attempt counts, for callers that
     * hold pre-computed statistics rather than raw records.
     */
    public static ActivityAggregate ofTotals(double averageAccuracy, int totalAttempts) {
        return new ActivityAggregate(0L, totalAttempts, 0, averageAccuracy, 0, zeroCounts(), List.of());
    }

    private static Map<ActivityType, Integer> zeroCounts() {
        Map<ActivityType, Integer> counts = new EnumMap<>(ActivityType.class);
        for (ActivityType type : ActivityType.values()) {
            counts.put(type, 0);
        }
        return counts;
    }
}
