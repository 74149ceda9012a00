package uk.gegc.linguapath.features.repetition.application;

import org.springframework.stereotype.Component;
import uk.gegc.linguapath.features.repetition.domain.model.VocabularyEntry;

import java.time.Duration;
import java.time.Instant;

@Component
public class RepetitionPriorityCalculator {

    public int compute(VocabularyEntry entry, Instant now) {
        if (entry.nextReviewDueAt() == null || !entry.isDue(now)) return 0;

        long overdueDays = Math.max(0, Duration.between(entry.nextReviewDueAt(), now).toDays());
        int masteryWeight = masteryWeight(entry.masteryLevel());

        long score = 20 + overdueDays * 5 + masteryWeight;
        return (int) Math.min(100, score);
    }

    private int masteryWeight(int masteryLevel) {
        int clamped = Math.max(VocabularyEntry.MIN_MASTERY, Math.min(VocabularyEntry.MAX_MASTERY, masteryLevel));
        return 6 * (VocabularyEntry.MAX_MASTERY - clamped);
    }
}
