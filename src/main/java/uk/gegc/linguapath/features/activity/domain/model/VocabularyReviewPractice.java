package uk.gegc.linguapath.features.activity.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import uk.gegc.linguapath.features.repetition.domain.model.ReviewOutcome;

import java.time.Instant;

@Schema(name = "VocabularyReviewPractice", description = "A single word review from the review queue")
public record VocabularyReviewPractice(
        @Schema(description = "Reviewed word", example = "ubiquitous", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String word,
        @Schema(description = "Learner's answer", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        ReviewOutcome outcome,
        @Schema(description = "Seconds spent", example = "8")
        @PositiveOrZero
        long timeSpentSeconds,
        @Schema(description = "Review time (UTC); defaults to the server clock")
        Instant reviewedAt
) {
}
