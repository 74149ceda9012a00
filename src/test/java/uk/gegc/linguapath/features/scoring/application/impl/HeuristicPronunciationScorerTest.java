package uk.gegc.linguapath.features.scoring.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.linguapath.BaseUnitTest;
import uk.gegc.linguapath.features.scoring.domain.model.PronunciationMistake;
import uk.gegc.linguapath.features.scoring.domain.model.PronunciationScore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("HeuristicPronunciationScorer Tests")
class HeuristicPronunciationScorerTest extends BaseUnitTest {

    private HeuristicPronunciationScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new HeuristicPronunciationScorer();
    }

    @Test
    @DisplayName("Two of three words matched with confidence 0.8")
    void partialMatch_scoresAccuracyPlusConfidenceBonus() {
        PronunciationScore score = scorer.score("I like apples", "I like oranges", 0.8);

        assertThat(score.accuracyScore()).isCloseTo(66.67, within(0.01));
        assertThat(score.overallScore()).isCloseTo(82.67, within(0.01));
        assertEquals(80, score.fluencyScore());
        assertEquals(74, score.pronunciationScore());
        assertThat(score.mistakes()).containsExactly(
                new PronunciationMistake(2, "apples", "oranges", "Focus on the pronunciation of \"apples\"."));
    }

    @Test
    @DisplayName("Case and punctuation are ignored when matching")
    void normalization_ignoresCaseAndPunctuation() {
        PronunciationScore score = scorer.score("Hello, World!", "hello world", 0.0);

        assertEquals(100.0, score.accuracyScore(), 0.0001);
        assertEquals(100.0, score.overallScore(), 0.0001);
        assertThat(score.mistakes()).isEmpty();
        assertThat(score.feedback()).startsWith("Excellent");
    }

    @Test
    @DisplayName("A word contained in the other counts as a match")
    void substring_countsAsMatch() {
        PronunciationScore score = scorer.score("two cats", "two cat", 0.5);

        assertEquals(100.0, score.accuracyScore(), 0.0001);
    }

    @Test
    @DisplayName("Missing spoken words are reported as not recognized, at most three")
    void missingWords_reportedUpToThree() {
        PronunciationScore score = scorer.score("one two three four five", "one", 1.0);

        assertEquals(20.0, score.accuracyScore(), 0.0001);
        assertEquals(40.0, score.overallScore(), 0.0001);
        assertThat(score.mistakes()).hasSize(3)
                .extracting(PronunciationMistake::actual)
                .containsOnly(HeuristicPronunciationScorer.NOT_RECOGNIZED);
        assertThat(score.mistakes()).extracting(PronunciationMistake::position).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("Overall score never exceeds 100")
    void overall_isCapped() {
        PronunciationScore score = scorer.score("good morning", "good morning", 1.0);

        assertEquals(100.0, score.overallScore(), 0.0001);
        assertEquals(90, score.pronunciationScore());
    }

    @Test
    @DisplayName("Confidence outside 0-1 is clamped")
    void confidence_isClamped() {
        assertEquals(100, scorer.score("a", "b", 1.7).fluencyScore());
        assertEquals(0, scorer.score("a", "b", -0.3).fluencyScore());
    }

    @Test
    @DisplayName("Empty or null texts score zero accuracy without failing")
    void emptyTexts_scoreZero() {
        PronunciationScore score = scorer.score(null, null, 0.5);

        assertEquals(0.0, score.accuracyScore(), 0.0001);
        assertEquals(10.0, score.overallScore(), 0.0001);
        assertThat(score.mistakes()).isEmpty();
        assertThat(score.subScores()).containsKeys("accuracy", "fluency", "pronunciation");
    }

    @Test
    @DisplayName("Feedback follows the overall score band")
    void feedback_followsBands() {
        assertThat(scorer.score("a b c d e", "a b c d x", 0.0).feedback()).startsWith("Good pronunciation")
                .doesNotStartWith("Excellent");
        assertThat(scorer.score("a b c d e", "x x x x x", 0.0).feedback()).startsWith("Keep practising");
    }
}
