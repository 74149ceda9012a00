package uk.gegc.linguapath.features.activity.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import uk.gegc.linguapath.features.activity.domain.model.ActivityRecord;
import uk.gegc.linguapath.features.activity.domain.model.AggregationWindow;

import java.time.LocalDate;
import java.util.List;

@Schema(name = "AggregateRequest", description = "Activity records and the window to aggregate them over")
public record AggregateRequest(
        @Schema(description = "Raw activity records", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        List<@NotNull @Valid ActivityRecord> records,
        @Schema(description = "Inclusive window; omitted means all records")
        AggregationWindow window,
        @Schema(description = "Calendar day the streak is counted back from; defaults to today in the server zone",
                example = "2024-01-01")
        LocalDate today
) {
}
