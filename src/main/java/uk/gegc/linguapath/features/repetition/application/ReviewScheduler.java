package uk.gegc.linguapath.features.repetition.application;

import uk.gegc.linguapath.features.repetition.domain.model.ReviewOutcome;
import uk.gegc.linguapath.features.repetition.domain.model.ScheduledReview;
import uk.gegc.linguapath.features.repetition.domain.model.VocabularyEntry;

import java.time.Instant;

public interface ReviewScheduler {

    /**
     * Applies one review to an entry. Out-of-range stored values are clamped and reported
     * in {@link ScheduledReview#warnings()}; the input entry is not modified.
     */
    ScheduledReview applyReview(VocabularyEntry entry, ReviewOutcome outcome, Instant now);

    /**
     * A word that has never been reviewed and is due immediately.
     */
    VocabularyEntry newEntry(String text, Instant now);
}
