package uk.gegc.linguapath.features.scoring.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

@Schema(name = "PronunciationScoreRequest", description = "Reference text and recognised transcript to compare")
public record PronunciationScoreRequest(
        @Schema(description = "Reference text the learner read aloud", example = "The quick brown fox",
                requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        String originalText,
        @Schema(description = "Transcript returned by the speech recogniser", example = "the quick brown box")
        String spokenText,
        @Schema(description = "Recogniser confidence 0-1", example = "0.85")
        @DecimalMin("0.0") @DecimalMax("1.0")
        Double confidence
) {
}
