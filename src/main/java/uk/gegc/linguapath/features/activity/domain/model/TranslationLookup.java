package uk.gegc.linguapath.features.activity.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;

@Schema(name = "TranslationLookup", description = "A dictionary or translation lookup")
public record TranslationLookup(
        @Schema(description = "Word that was looked up", example = "ubiquitous", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String word,
        @Schema(description = "Seconds spent", example = "5")
        @PositiveOrZero
        long timeSpentSeconds,
        @Schema(description = "Lookup time (UTC); defaults to the server clock")
        Instant lookedUpAt
) {
}
