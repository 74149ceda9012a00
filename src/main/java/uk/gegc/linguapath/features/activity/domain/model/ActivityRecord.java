package uk.gegc.linguapath.features.activity.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;

@Schema(name = "ActivityRecord", description = "A single practice event produced by a practice session")
public record ActivityRecord(
        @Schema(description = "Activity the record belongs to", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        ActivityType type,
        @Schema(description = "When the activity happened (UTC)", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        Instant timestamp,
        @Schema(description = "Seconds spent on the activity")
        @PositiveOrZero
        long timeSpentSeconds,
        @Schema(description = "Accuracy 0-100; absent for ungraded activities", nullable = true)
        @DecimalMin("0.0") @DecimalMax("100.0")
        Double accuracy,
        @Schema(description = "Vocabulary word the activity refers to", nullable = true)
        String wordRef
) {

    public static ActivityRecord graded(ActivityType type, Instant timestamp, long timeSpentSeconds, double accuracy) {
        return new ActivityRecord(type, timestamp, timeSpentSeconds, accuracy, null);
    }

    public static ActivityRecord ungraded(ActivityType type, Instant timestamp, long timeSpentSeconds) {
        return new ActivityRecord(type, timestamp, timeSpentSeconds, null, null);
    }

    @JsonIgnore
    public boolean isGraded() {
        return accuracy != null && !accuracy.isNaN();
    }
}
