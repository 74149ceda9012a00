package uk.gegc.linguapath.features.assessment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import uk.gegc.linguapath.features.activity.domain.model.ActivityRecord;
import uk.gegc.linguapath.features.activity.domain.model.AggregationWindow;

import java.util.List;

@Schema(name = "ProficiencyRequest", description = "Raw activity records to assess")
public record ProficiencyRequest(
        @Schema(description = "Raw activity records", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        List<@NotNull @Valid ActivityRecord> records,
        @Schema(description = "Inclusive window; omitted means all records")
        AggregationWindow window
) {
}
