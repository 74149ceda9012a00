package uk.gegc.linguapath.features.repetition.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import uk.gegc.linguapath.features.repetition.domain.model.ReviewOutcome;
import uk.gegc.linguapath.features.repetition.domain.model.VocabularyEntry;

import java.time.Instant;

@Schema(name = "ReviewRequest", description = "Stored entry state and the learner's answer")
public record ReviewRequest(
        @Schema(description = "Entry as currently stored", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        @Valid
        VocabularyEntry entry,
        @Schema(description = "Review outcome", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        ReviewOutcome outcome,
        @Schema(description = "Review time (UTC); defaults to the server clock")
        Instant reviewedAt
) {
}
