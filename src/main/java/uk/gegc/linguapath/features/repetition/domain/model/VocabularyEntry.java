package uk.gegc.linguapath.features.repetition.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

@Schema(name = "VocabularyEntry", description = "A word under spaced repetition with its review state")
public record VocabularyEntry(
        @Schema(description = "The word or phrase", example = "ubiquitous", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String text,
        @Schema(description = "Mastery level 0-5", example = "2")
        int masteryLevel,
        @Schema(description = "Number of reviews so far")
        int reviewCount,
        @Schema(description = "Number of reviews answered KNOWN")
        int correctCount,
        @Schema(description = "Last review time (UTC); null or the creation time for a word never reviewed")
        Instant lastReviewedAt,
        @Schema(description = "Time the word becomes due (UTC)", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        Instant nextReviewDueAt
) {

    public static final int MIN_MASTERY = 0;
    public static final int MAX_MASTERY = 5;

    public static VocabularyEntry neverReviewed(String text, Instant now) {
        return new VocabularyEntry(text, MIN_MASTERY, 0, 0, null, now);
    }

    @JsonIgnore
    public boolean isNeverReviewed() {
        return reviewCount <= 0;
    }

    public boolean isDue(Instant now) {
        return nextReviewDueAt != null && !nextReviewDueAt.isAfter(now);
    }
}
