package uk.gegc.linguapath.features.repetition.application;

import uk.gegc.linguapath.features.repetition.domain.model.VocabularyEntry;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface ReviewQueueService {

    /**
     * Every due entry, in review order.
     */
    List<VocabularyEntry> dueForReview(Collection<VocabularyEntry> entries, Instant now);

    /**
     * Due entries in review order. Previously reviewed words come first, most overdue first;
     * never-reviewed words ({@code reviewCount == 0}) follow, oldest due date first.
     *
     * @param limit maximum queue length; null or non-positive means no limit
     */
    List<VocabularyEntry> dueForReview(Collection<VocabularyEntry> entries, Instant now, Integer limit);
}
