package uk.gegc.linguapath.features.activity.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.linguapath.features.activity.domain.model.ActivityRecord;
import uk.gegc.linguapath.features.activity.domain.model.ActivityType;
import uk.gegc.linguapath.features.activity.domain.model.ComprehensionPractice;
import uk.gegc.linguapath.features.activity.domain.model.SpeakingPractice;
import uk.gegc.linguapath.features.activity.domain.model.TranslationLookup;
import uk.gegc.linguapath.features.activity.domain.model.VocabularyReviewPractice;
import uk.gegc.linguapath.features.activity.domain.model.WritingPractice;
import uk.gegc.linguapath.features.scoring.domain.model.PronunciationScore;
import uk.gegc.linguapath.features.scoring.domain.model.WritingScore;

import java.time.Clock;
import java.time.Instant;

/**
 * Turns finished practice sessions and scorer results into activity records.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PracticeRecordFactory {

    static final double DEFAULT_FLUENCY = 70.0;
    static final double DEFAULT_COMPLETENESS = 80.0;
    static final double DEFAULT_CREATIVITY = 70.0;

    private final Clock clock;

    public ActivityRecord reading(ComprehensionPractice practice) {
        return comprehension(ActivityType.READING, practice);
    }

    public ActivityRecord listening(ComprehensionPractice practice) {
        return comprehension(ActivityType.LISTENING, practice);
    }

    /**
     * Weighted 60/25/15 over pronunciation, fluency and completeness.
     */
    public ActivityRecord speaking(SpeakingPractice practice) {
        double fluency = orDefault(practice.fluencyScore(), DEFAULT_FLUENCY);
        double completeness = orDefault(practice.completenessScore(), DEFAULT_COMPLETENESS);
        double accuracy = practice.pronunciationScore() * 0.6 + fluency * 0.25 + completeness * 0.15;
        return build(ActivityType.SPEAKING, practice.completedAt(), practice.timeSpentSeconds(), accuracy, practice.word());
    }

    /**
     * Uses the scorer's word-match accuracy as completeness.
     */
    public ActivityRecord speaking(PronunciationScore score, long timeSpentSeconds, Instant completedAt, String word) {
        return speaking(new SpeakingPractice(
                (double) score.pronunciationScore(),
                (double) score.fluencyScore(),
                score.accuracyScore(),
                timeSpentSeconds,
                completedAt,
                word
        ));
    }

    /**
     * Weighted 35/25/30/10 over grammar, vocabulary, coherence and creativity.
     */
    public ActivityRecord writing(WritingPractice practice) {
        double creativity = orDefault(practice.creativityScore(), DEFAULT_CREATIVITY);
        double accuracy = practice.grammarScore() * 0.35
                + practice.vocabularyScore() * 0.25
                + practice.coherenceScore() * 0.3
                + creativity * 0.1;
        return build(ActivityType.WRITING, practice.completedAt(), practice.timeSpentSeconds(), accuracy, null);
    }

    public ActivityRecord writing(WritingScore score, long timeSpentSeconds, Instant completedAt) {
        return build(ActivityType.WRITING, completedAt, timeSpentSeconds, score.overallScore(), null);
    }

    /**
     * Lookups are ungraded: they count as activity but never as an attempt.
     */
    public ActivityRecord translation(TranslationLookup lookup) {
        return new ActivityRecord(
                ActivityType.TRANSLATION,
                timestampOrNow(lookup.lookedUpAt()),
                Math.max(0L, lookup.timeSpentSeconds()),
                null,
                lookup.word().trim()
        );
    }

    public ActivityRecord vocabularyReview(VocabularyReviewPractice review) {
        return build(
                ActivityType.READING,
                review.reviewedAt(),
                review.timeSpentSeconds(),
                review.outcome().getPracticeAccuracy(),
                review.word().trim()
        );
    }

    private ActivityRecord comprehension(ActivityType type, ComprehensionPractice practice) {
        double accuracy = practice.totalQuestions() > 0
                ? 100.0 * practice.correctAnswers() / practice.totalQuestions()
                : practice.fallbackScore();
        return build(type, practice.completedAt(), practice.timeSpentSeconds(), accuracy, null);
    }

    private ActivityRecord build(ActivityType type, Instant at, long timeSpentSeconds, double accuracy, String wordRef) {
        double clamped = Math.max(0.0, Math.min(100.0, accuracy));
        ActivityRecord record = new ActivityRecord(type, timestampOrNow(at), Math.max(0L, timeSpentSeconds), clamped, wordRef);
        log.debug("Built {} record with accuracy {}", type, clamped);
        return record;
    }

    private Instant timestampOrNow(Instant at) {
        return at != null ? at : Instant.now(clock);
    }

    private double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
