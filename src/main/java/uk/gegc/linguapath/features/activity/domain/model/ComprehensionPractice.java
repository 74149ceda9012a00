package uk.gegc.linguapath.features.activity.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;

@Schema(name = "ComprehensionPractice", description = "Summary of a finished reading or listening exercise")
public record ComprehensionPractice(
        @Schema(description = "Questions or segments in the exercise", example = "10")
        @PositiveOrZero
        int totalQuestions,
        @Schema(description = "Questions or segments answered correctly", example = "8")
        @PositiveOrZero
        int correctAnswers,
        @Schema(description = "Score 0-100 used when the exercise had no questions", example = "75")
        @DecimalMin("0.0") @DecimalMax("100.0")
        double fallbackScore,
        @Schema(description = "Seconds spent", example = "420")
        @PositiveOrZero
        long timeSpentSeconds,
        @Schema(description = "Completion time (UTC); defaults to the server clock")
        Instant completedAt
) {
}
