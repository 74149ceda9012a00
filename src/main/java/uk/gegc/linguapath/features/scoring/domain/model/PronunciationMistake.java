package uk.gegc.linguapath.features.scoring.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "PronunciationMistake", description = "A word position where the transcript did not match the reference")
public record PronunciationMistake(
        @Schema(description = "Zero-based word position in the reference text")
        int position,
        @Schema(description = "Expected word")
        String expected,
        @Schema(description = "Recognised word, or [not recognized]")
        String actual,
        @Schema(description = "Practice suggestion")
        String suggestion
) {
}
