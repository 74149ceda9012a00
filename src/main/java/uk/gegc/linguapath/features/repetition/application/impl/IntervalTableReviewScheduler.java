package uk.gegc.linguapath.features.repetition.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.linguapath.features.repetition.application.ReviewScheduler;
import uk.gegc.linguapath.features.repetition.domain.model.IntervalBand;
import uk.gegc.linguapath.features.repetition.domain.model.ReviewIntervalTable;
import uk.gegc.linguapath.features.repetition.domain.model.ReviewOutcome;
import uk.gegc.linguapath.features.repetition.domain.model.ScheduledReview;
import uk.gegc.linguapath.features.repetition.domain.model.VocabularyEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mastery-level scheduler: UNKNOWN drops a level and comes back soon, FAMILIAR keeps the level,
 * KNOWN climbs a level and is pushed furthest out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntervalTableReviewScheduler implements ReviewScheduler {

    private final ReviewIntervalTable intervalTable;

    @Override
    public ScheduledReview applyReview(VocabularyEntry entry, ReviewOutcome outcome, Instant now) {
        List<String> warnings = new ArrayList<>();
        int level = clamp(entry.masteryLevel(), VocabularyEntry.MIN_MASTERY, VocabularyEntry.MAX_MASTERY,
                "masteryLevel", entry.text(), warnings);
        int reviewCount = clamp(entry.reviewCount(), 0, Integer.MAX_VALUE, "reviewCount", entry.text(), warnings);
        int correctCount = clamp(entry.correctCount(), 0, Integer.MAX_VALUE, "correctCount", entry.text(), warnings);

        Transition transition = switch (outcome) {
            case UNKNOWN -> new Transition(Math.max(VocabularyEntry.MIN_MASTERY, level - 1), IntervalBand.SHORT);
            case FAMILIAR -> new Transition(level, IntervalBand.MEDIUM);
            case KNOWN -> new Transition(Math.min(VocabularyEntry.MAX_MASTERY, level + 1), IntervalBand.LONG);
        };
        int newLevel = transition.level();
        if (outcome == ReviewOutcome.KNOWN) {
            correctCount = increment(correctCount);
        }

        Instant nextDue = now.plus(intervalTable.interval(newLevel, transition.band()));
        VocabularyEntry updated = new VocabularyEntry(
                entry.text(),
                newLevel,
                increment(reviewCount),
                correctCount,
                now,
                nextDue
        );
        log.debug("Reviewed '{}' as {}: level {} -> {}, next due {}", entry.text(), outcome, level, newLevel, nextDue);
        return new ScheduledReview(updated, warnings);
    }

    @Override
    public VocabularyEntry newEntry(String text, Instant now) {
        return VocabularyEntry.neverReviewed(text, now);
    }

    private int clamp(int value, int min, int max, String field, String text, List<String> warnings) {
        if (value >= min && value <= max) {
            return value;
        }
        int clamped = Math.max(min, Math.min(max, value));
        String warning = "Stored " + field + " " + value + " for '" + text + "' is out of range; clamped to " + clamped;
        log.warn(warning);
        warnings.add(warning);
        return clamped;
    }

    private int increment(int counter) {
        return counter == Integer.MAX_VALUE ? counter : counter + 1;
    }

    private record Transition(int level, IntervalBand band) {
    }
}
