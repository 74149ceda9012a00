package uk.gegc.linguapath.features.scoring.application;

import uk.gegc.linguapath.features.scoring.domain.model.PronunciationScore;

public interface PronunciationScorer {

    /**
     * Scores a recognised transcript against the reference text it should have matched.
     *
     * @param originalText reference text; null is treated as empty
     * @param spokenText   transcript from the recogniser; null is treated as empty
     * @param confidence   recogniser confidence, clamped into [0, 1]
     */
    PronunciationScore score(String originalText, String spokenText, double confidence);
}
