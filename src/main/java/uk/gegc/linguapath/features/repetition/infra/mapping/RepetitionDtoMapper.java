package uk.gegc.linguapath.features.repetition.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.linguapath.features.repetition.application.dto.DueEntryDto;
import uk.gegc.linguapath.features.repetition.domain.model.VocabularyEntry;

@Component
public class RepetitionDtoMapper {

    public DueEntryDto toDueEntryDto(VocabularyEntry entry, int priorityScore) {
        return new DueEntryDto(
                entry.text(),
                entry.masteryLevel(),
                entry.reviewCount(),
                entry.correctCount(),
                entry.lastReviewedAt(),
                entry.nextReviewDueAt(),
                priorityScore
        );
    }
}
