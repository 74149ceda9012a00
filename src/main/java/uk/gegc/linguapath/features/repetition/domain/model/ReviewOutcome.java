package uk.gegc.linguapath.features.repetition.domain.model;

import lombok.Getter;

/**
 * Learner's self-assessment after reviewing a word.
 */
@Getter
public enum ReviewOutcome {
    UNKNOWN(30),
    FAMILIAR(70),
    KNOWN(100);

    /**
     * Accuracy recorded for the review when it is logged as practice activity.
     */
    private final int practiceAccuracy;

    ReviewOutcome(int practiceAccuracy) {
        this.practiceAccuracy = practiceAccuracy;
    }
}
