package uk.gegc.linguapath.features.scoring.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.linguapath.features.scoring.application.WritingScorer;
import uk.gegc.linguapath.features.scoring.domain.model.CriterionScore;
import uk.gegc.linguapath.features.scoring.domain.model.RubricCriterion;
import uk.gegc.linguapath.features.scoring.domain.model.WritingCriterionKind;
import uk.gegc.linguapath.features.scoring.domain.model.WritingRubric;
import uk.gegc.linguapath.features.scoring.domain.model.WritingScore;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rubric-driven writing scorer built on surface statistics of the text.
 */
@Slf4j
@Service
public class HeuristicWritingScorer implements WritingScorer {

    private static final Pattern MISSING_APOSTROPHE =
            Pattern.compile("\\b(dont|wont|cant|shouldnt|didnt|doesnt|isnt)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LOWERCASE_TEXT_START = Pattern.compile("^\\s*[a-z]");
    private static final Pattern LOWERCASE_SENTENCE_START = Pattern.compile("[.!?]\\s+[a-z]");
    private static final Pattern LOWERCASE_PRONOUN_I = Pattern.compile("\\bi\\b");

    private static final double UNKNOWN_CRITERION_SHARE = 0.75;
    private static final double SUGGESTION_THRESHOLD = 70.0;
    private static final double LENGTH_SHARE_FOR_SUGGESTION = 0.8;
    private static final int MAX_SUGGESTIONS = 3;

    @Override
    public WritingScore score(String content, WritingRubric rubric, Integer wordLimit, List<String> keywords) {
        String text = TextStatistics.nullToEmpty(content);
        WritingRubric effectiveRubric = rubric == null || rubric.criteria().isEmpty() ? WritingRubric.DEFAULT : rubric;
        Integer effectiveLimit = wordLimit != null && wordLimit > 0 ? wordLimit : null;
        List<String> effectiveKeywords = keywords == null ? List.of() : keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .toList();

        TextProfile profile = TextProfile.of(text);

        List<CriterionScore> criteriaScores = new ArrayList<>();
        int totalScore = 0;
        int maxTotal = 0;
        for (RubricCriterion criterion : effectiveRubric.criteria()) {
            int max = criterion.maxPoints();
            int points = profile.blank()
                    ? 0
                    : (int) Math.round(Math.min(max, rawScore(criterion, profile, effectiveLimit, effectiveKeywords)));
            criteriaScores.add(new CriterionScore(criterion.id(), points, max, criterionFeedback(criterion.id(), points, max)));
            totalScore += points;
            maxTotal += max;
        }

        double overallScore = maxTotal == 0 ? 0.0 : 100.0 * totalScore / maxTotal;
        log.debug("Writing scored: words={}, sentences={}, total={}/{}",
                profile.wordCount(), profile.sentenceCount(), totalScore, maxTotal);

        return new WritingScore(
                overallScore,
                totalScore,
                maxTotal,
                criteriaScores,
                overallFeedback(overallScore, profile),
                suggestions(criteriaScores, profile, effectiveLimit),
                profile.wordCount(),
                profile.sentenceCount()
        );
    }

    private double rawScore(RubricCriterion criterion, TextProfile profile, Integer wordLimit, List<String> keywords) {
        int max = criterion.maxPoints();
        Optional<WritingCriterionKind> kind = WritingCriterionKind.fromId(criterion.id());
        if (kind.isEmpty()) {
            return max * UNKNOWN_CRITERION_SHARE;
        }
        return switch (kind.get()) {
            case CONTENT -> contentScore(profile, max, wordLimit, keywords);
            case ORGANIZATION -> organizationScore(profile, max);
            case GRAMMAR -> grammarScore(profile, max);
            case VOCABULARY -> vocabularyScore(profile, max);
            case MECHANICS -> mechanicsScore(profile, max);
        };
    }

    private double contentScore(TextProfile profile, int max, Integer wordLimit, List<String> keywords) {
        double score;
        if (wordLimit != null) {
            double lengthRatio = Math.min(1.0, (double) profile.wordCount() / wordLimit);
            score = max * (0.5 + 0.5 * lengthRatio);
        } else {
            score = max * 0.8;
        }
        if (!keywords.isEmpty()) {
            String lowered = profile.text().toLowerCase(Locale.ROOT);
            long found = keywords.stream()
                    .filter(k -> lowered.contains(k.toLowerCase(Locale.ROOT)))
                    .count();
            score += max * 0.2 * found / keywords.size();
        }
        return Math.min(max, score);
    }

    private double organizationScore(TextProfile profile, int max) {
        if (profile.paragraphCount() >= 3) return max * 0.9;
        if (profile.paragraphCount() == 2) return max * 0.7;
        return max * 0.5;
    }

    private double grammarScore(TextProfile profile, int max) {
        String text = profile.text();
        int errors = TextStatistics.countMatches(MISSING_APOSTROPHE, text)
                + TextStatistics.countMatches(LOWERCASE_TEXT_START, text)
                + TextStatistics.countMatches(LOWERCASE_SENTENCE_START, text)
                + TextStatistics.countMatches(LOWERCASE_PRONOUN_I, text);
        double errorRate = (double) errors / profile.sentenceDivisor();
        return max * Math.max(0.4, 1.0 - 0.5 * errorRate);
    }

    private double vocabularyScore(TextProfile profile, int max) {
        List<String> words = profile.words();
        if (words.isEmpty()) {
            return max * 0.3;
        }
        double diversity = (double) new HashSet<>(words).size() / words.size();
        return max * (0.3 + 0.7 * diversity);
    }

    private double mechanicsScore(TextProfile profile, int max) {
        double ratio = (double) TextStatistics.punctuationCount(profile.text()) / profile.sentenceDivisor();
        return max * Math.min(1.0, ratio);
    }

    private String criterionFeedback(String criterionId, int score, int max) {
        double percentage = max <= 0 ? 100.0 : 100.0 * score / max;
        Optional<WritingCriterionKind> kind = WritingCriterionKind.fromId(criterionId);
        if (kind.isEmpty()) {
            return "Criterion scored.";
        }
        String[] bands = switch (kind.get()) {
            case CONTENT -> new String[]{
                    "Rich content with a clear position that answers the task well.",
                    "Content is mostly complete and the position is fairly clear.",
                    "Content is thin; add more details and examples.",
                    "Content is too simple; add material that supports your ideas."};
            case ORGANIZATION -> new String[]{
                    "Clear structure with well-arranged paragraphs.",
                    "Structure is fairly clear and the logic mostly flows.",
                    "Structure needs work; divide the text into clearer paragraphs.",
                    "The text lacks structure; reorganise its logic."};
            case GRAMMAR -> new String[]{
                    "Accurate grammar with varied sentence patterns.",
                    "Grammar is mostly correct with the odd slip.",
                    "There are several grammar errors; proofread carefully.",
                    "Frequent grammar errors; practise the basics."};
            case VOCABULARY -> new String[]{
                    "Vocabulary is apt and varied.",
                    "Vocabulary is mostly appropriate.",
                    "Vocabulary is ordinary; try more varied words.",
                    "Vocabulary is repetitive; work on expanding it."};
            case MECHANICS -> new String[]{
                    "Punctuation and spelling are correct.",
                    "Punctuation and spelling are mostly correct.",
                    "A few punctuation or spelling issues.",
                    "Punctuation and spelling need attention."};
        };
        if (percentage >= 90) return bands[0];
        if (percentage >= 75) return bands[1];
        if (percentage >= 60) return bands[2];
        return bands[3];
    }

    private String overallFeedback(double overallScore, TextProfile profile) {
        String band;
        if (profile.blank()) {
            band = "Nothing was written, so the text could not be assessed.";
        } else if (overallScore >= 90) {
            band = "Excellent! A high-quality text that is strong in every area.";
        } else if (overallScore >= 80) {
            band = "Very good! A solid text with room to improve in a few areas.";
        } else if (overallScore >= 70) {
            band = "Good. The text meets the basic requirements; practise the weaker areas.";
        } else if (overallScore >= 60) {
            band = "Pass. The text has a foundation but needs work in several areas.";
        } else {
            band = "Needs improvement. Read model texts and practise the basic writing skills.";
        }
        return band + " The text has " + profile.wordCount() + " words in " + profile.sentenceCount() + " sentences.";
    }

    private List<String> suggestions(List<CriterionScore> criteriaScores, TextProfile profile, Integer wordLimit) {
        List<String> suggestions = new ArrayList<>();
        for (CriterionScore cs : criteriaScores) {
            if (cs.percentage() >= SUGGESTION_THRESHOLD) continue;
            WritingCriterionKind.fromId(cs.criterionId())
                    .map(this::suggestionFor)
                    .ifPresent(suggestions::add);
        }
        if (wordLimit != null && profile.wordCount() < wordLimit * LENGTH_SHARE_FOR_SUGGESTION) {
            suggestions.add("The text has " + profile.wordCount() + " words; expand it towards the required "
                    + wordLimit + " words.");
        }
        if (suggestions.isEmpty()) {
            suggestions.add("Keep writing regularly and try new topics and text types.");
        }
        return suggestions.size() > MAX_SUGGESTIONS ? suggestions.subList(0, MAX_SUGGESTIONS) : suggestions;
    }

    private String suggestionFor(WritingCriterionKind kind) {
        return switch (kind) {
            case CONTENT -> "Add concrete examples and details to support your points.";
            case ORGANIZATION -> "Use linking words such as however, therefore and in addition between paragraphs.";
            case GRAMMAR -> "Proofread for grammar after writing, especially tense agreement.";
            case VOCABULARY -> "Use a wider range of words and avoid repeating the same ones.";
            case MECHANICS -> "Check punctuation and capitalisation at the start and end of each sentence.";
        };
    }

    private record TextProfile(String text, boolean blank, int wordCount, int sentenceCount,
                               int paragraphCount, List<String> words) {

        static TextProfile of(String text) {
            return new TextProfile(
                    text,
                    text.isBlank(),
                    TextStatistics.wordCount(text),
                    TextStatistics.sentenceCount(text),
                    TextStatistics.paragraphCount(text),
                    TextStatistics.lowerCaseWords(text)
            );
        }

        int sentenceDivisor() {
            return Math.max(1, sentenceCount);
        }
    }
}
