package uk.gegc.linguapath.features.assessment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import uk.gegc.linguapath.features.activity.domain.model.ActivityAggregate;

@Schema(name = "EvaluateModuleRequest", description = "Aggregate statistics of one skill module")
public record EvaluateModuleRequest(
        @Schema(description = "Aggregate produced by the activity aggregation endpoints",
                requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        ActivityAggregate aggregate
) {
}
