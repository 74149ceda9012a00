package uk.gegc.linguapath.features.scoring.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.linguapath.features.scoring.application.PronunciationScorer;
import uk.gegc.linguapath.features.scoring.domain.model.PronunciationMistake;
import uk.gegc.linguapath.features.scoring.domain.model.PronunciationScore;

import java.util.ArrayList;
import java.util.List;

/**
 * Approximates pronunciation quality by matching transcript words against the reference
 * position by position. No audio is analysed.
 */
@Slf4j
@Service
public class HeuristicPronunciationScorer implements PronunciationScorer {

    static final String NOT_RECOGNIZED = "[not recognized]";
    private static final int MAX_MISTAKES = 3;
    private static final double CONFIDENCE_BONUS = 20.0;
    private static final double PRONUNCIATION_FACTOR = 0.9;

    @Override
    public PronunciationScore score(String originalText, String spokenText, double confidence) {
        List<String> expected = TextStatistics.normalizedTokens(originalText);
        List<String> spoken = TextStatistics.normalizedTokens(spokenText);
        double clampedConfidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));

        int matched = 0;
        List<PronunciationMistake> mistakes = new ArrayList<>();
        for (int i = 0; i < expected.size(); i++) {
            String expectedWord = expected.get(i);
            String spokenWord = i < spoken.size() ? spoken.get(i) : null;
            if (spokenWord != null && wordsMatch(expectedWord, spokenWord)) {
                matched++;
            } else if (mistakes.size() < MAX_MISTAKES) {
                mistakes.add(new PronunciationMistake(
                        i,
                        expectedWord,
                        spokenWord != null ? spokenWord : NOT_RECOGNIZED,
                        "Focus on the pronunciation of \"" + expectedWord + "\"."
                ));
            }
        }

        double accuracyScore = expected.isEmpty() ? 0.0 : 100.0 * matched / expected.size();
        double overallScore = Math.min(100.0, accuracyScore + CONFIDENCE_BONUS * clampedConfidence);
        int fluencyScore = (int) Math.round(100.0 * clampedConfidence);
        int pronunciationScore = (int) Math.round(PRONUNCIATION_FACTOR * overallScore);

        log.debug("Pronunciation scored: matched={}/{}, confidence={}, overall={}",
                matched, expected.size(), clampedConfidence, overallScore);

        return new PronunciationScore(
                overallScore,
                accuracyScore,
                fluencyScore,
                pronunciationScore,
                feedbackFor(overallScore),
                mistakes
        );
    }

    private boolean wordsMatch(String expected, String spoken) {
        return expected.equals(spoken) || expected.contains(spoken) || spoken.contains(expected);
    }

    private String feedbackFor(double overallScore) {
        if (overallScore >= 90) return "Excellent pronunciation, keep it up!";
        if (overallScore >= 80) return "Good pronunciation with a few words to polish.";
        if (overallScore >= 70) return "Fair pronunciation; practise the highlighted words.";
        if (overallScore >= 60) return "Your pronunciation needs work; try shadowing the reference audio slowly.";
        return "Keep practising: listen to the reference and repeat it phrase by phrase.";
    }
}
