package uk.gegc.linguapath.features.repetition.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import uk.gegc.linguapath.features.repetition.domain.model.VocabularyEntry;

import java.time.Instant;
import java.util.List;

@Schema(name = "DueQueueRequest", description = "Entries to build a review queue from")
public record DueQueueRequest(
        @Schema(description = "The learner's entries", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        List<@Valid VocabularyEntry> entries,
        @Schema(description = "Reference time (UTC); defaults to the server clock")
        Instant now,
        @Schema(description = "Maximum queue length; defaults to the configured limit", example = "20")
        @Positive
        Integer limit
) {
}
