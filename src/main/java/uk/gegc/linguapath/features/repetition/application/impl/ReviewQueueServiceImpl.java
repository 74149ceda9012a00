package uk.gegc.linguapath.features.repetition.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.linguapath.features.repetition.application.ReviewQueueService;
import uk.gegc.linguapath.features.repetition.domain.model.VocabularyEntry;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

@Slf4j
@Service
public class ReviewQueueServiceImpl implements ReviewQueueService {

    private static final Comparator<VocabularyEntry> REVIEWED_ORDER = Comparator
            .comparing(VocabularyEntry::nextReviewDueAt)
            .thenComparingInt(VocabularyEntry::masteryLevel)
            .thenComparing(VocabularyEntry::text);

    private static final Comparator<VocabularyEntry> NEVER_REVIEWED_ORDER = Comparator
            .comparing(VocabularyEntry::nextReviewDueAt)
            .thenComparing(VocabularyEntry::text);

    @Override
    public List<VocabularyEntry> dueForReview(Collection<VocabularyEntry> entries, Instant now) {
        return dueForReview(entries, now, null);
    }

    @Override
    public List<VocabularyEntry> dueForReview(Collection<VocabularyEntry> entries, Instant now, Integer limit) {
        if (entries == null || entries.isEmpty()) {
            return List.of();
        }
        List<VocabularyEntry> due = entries.stream()
                .filter(entry -> entry != null && entry.isDue(now))
                .toList();

        Stream<VocabularyEntry> reviewed = due.stream()
                .filter(entry -> !entry.isNeverReviewed())
                .sorted(REVIEWED_ORDER);
        Stream<VocabularyEntry> fresh = due.stream()
                .filter(VocabularyEntry::isNeverReviewed)
                .sorted(NEVER_REVIEWED_ORDER);

        Stream<VocabularyEntry> queue = Stream.concat(reviewed, fresh);
        if (limit != null && limit > 0) {
            queue = queue.limit(limit);
        }
        List<VocabularyEntry> result = queue.toList();
        log.debug("Review queue: {} of {} entries due, returning {}", due.size(), entries.size(), result.size());
        return result;
    }
}
