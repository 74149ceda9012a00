package uk.gegc.linguapath.features.assessment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import uk.gegc.linguapath.features.assessment.domain.model.ModuleAssessment;

import java.util.List;

@Schema(name = "DecideRequest", description = "One assessment per skill module")
public record DecideRequest(
        @Schema(description = "Exactly four module assessments, one per skill module",
                requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        List<@NotNull @Valid ModuleAssessment> assessments
) {
}
