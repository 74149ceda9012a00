package uk.gegc.linguapath.features.repetition.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "DueEntryDto", description = "A due word with scheduling details and display priority")
public record DueEntryDto(
        @Schema(description = "The word or phrase")
        String text,
        @Schema(description = "Mastery level 0-5")
        int masteryLevel,
        @Schema(description = "Number of reviews so far")
        int reviewCount,
        @Schema(description = "Number of reviews answered KNOWN")
        int correctCount,
        @Schema(description = "Last review time (UTC); null for a word never reviewed")
        Instant lastReviewedAt,
        @Schema(description = "Time the word became due (UTC)")
        Instant nextReviewDueAt,
        @Schema(description = "Computed priority score for display")
        int priorityScore
) {
}
