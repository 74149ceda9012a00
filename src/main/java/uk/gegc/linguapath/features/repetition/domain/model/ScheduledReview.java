package uk.gegc.linguapath.features.repetition.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ScheduledReview", description = "Entry state after a review, with notes about clamped stored values")
public record ScheduledReview(
        @Schema(description = "Updated entry")
        VocabularyEntry entry,
        @Schema(description = "Out-of-range stored values that were clamped before scheduling")
        List<String> warnings
) {

    public ScheduledReview {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
