package uk.gegc.linguapath.features.assessment.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ProficiencyReport", description = "Assessment computed from raw records, with study recommendations")
public record ProficiencyReport(
        ProficiencyAssessment assessment,
        @Schema(description = "At most five study recommendations")
        List<String> recommendations
) {

    public ProficiencyReport {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
