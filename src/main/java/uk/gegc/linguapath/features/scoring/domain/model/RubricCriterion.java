package uk.gegc.linguapath.features.scoring.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

@Schema(name = "RubricCriterion", description = "One criterion of a writing rubric")
public record RubricCriterion(
        @Schema(description = "Criterion id; content, organization, grammar, vocabulary and mechanics are scored heuristically",
                example = "grammar", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String id,
        @Schema(description = "Display name")
        String name,
        @Schema(description = "Maximum points for the criterion", example = "25")
        @Positive
        int maxPoints
) {
}
