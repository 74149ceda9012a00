package uk.gegc.linguapath.features.repetition.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "NewEntryRequest", description = "Word to start tracking")
public record NewEntryRequest(
        @Schema(description = "The word or phrase", example = "ubiquitous", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        @Size(max = 200)
        String text
) {
}
