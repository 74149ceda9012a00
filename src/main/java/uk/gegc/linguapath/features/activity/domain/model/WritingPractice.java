package uk.gegc.linguapath.features.activity.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;

@Schema(name = "WritingPractice", description = "Summary of a finished writing task")
public record WritingPractice(
        @Schema(description = "Grammar score 0-100", example = "80", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        @DecimalMin("0.0") @DecimalMax("100.0")
        Double grammarScore,
        @Schema(description = "Vocabulary score 0-100", example = "70", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        @DecimalMin("0.0") @DecimalMax("100.0")
        Double vocabularyScore,
        @Schema(description = "Coherence score 0-100", example = "75", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        @DecimalMin("0.0") @DecimalMax("100.0")
        Double coherenceScore,
        @Schema(description = "Creativity score 0-100; 70 when absent", example = "70")
        @DecimalMin("0.0") @DecimalMax("100.0")
        Double creativityScore,
        @Schema(description = "Seconds spent", example = "1200")
        @PositiveOrZero
        long timeSpentSeconds,
        @Schema(description = "Completion time (UTC); defaults to the server clock")
        Instant completedAt
) {
}
