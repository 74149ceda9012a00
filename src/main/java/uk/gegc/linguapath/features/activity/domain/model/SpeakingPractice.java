package uk.gegc.linguapath.features.activity.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;

@Schema(name = "SpeakingPractice", description = "Summary of a finished speaking attempt")
public record SpeakingPractice(
        @Schema(description = "Pronunciation score 0-100", example = "82", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        @DecimalMin("0.0") @DecimalMax("100.0")
        Double pronunciationScore,
        @Schema(description = "Fluency score 0-100; 70 when absent", example = "75")
        @DecimalMin("0.0") @DecimalMax("100.0")
        Double fluencyScore,
        @Schema(description = "Completeness score 0-100; 80 when absent", example = "90")
        @DecimalMin("0.0") @DecimalMax("100.0")
        Double completenessScore,
        @Schema(description = "Seconds spent", example = "60")
        @PositiveOrZero
        long timeSpentSeconds,
        @Schema(description = "Completion time (UTC); defaults to the server clock")
        Instant completedAt,
        @Schema(description = "Word practised, when the attempt targeted a single word")
        String word
) {
}
