package uk.gegc.linguapath.features.scoring.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

@Schema(name = "WritingScore", description = "Rubric-based heuristic score of a written attempt")
public record WritingScore(
        @Schema(description = "Total points as a percentage of the rubric maximum, 0-100")
        double overallScore,
        @Schema(description = "Sum of criterion scores")
        int totalScore,
        @Schema(description = "Sum of criterion maxima")
        int maxScore,
        @Schema(description = "Per-criterion scores in rubric order")
        List<CriterionScore> criteriaScores,
        @Schema(description = "Overall feedback")
        String feedback,
        @Schema(description = "Up to three improvement suggestions")
        List<String> suggestions,
        @Schema(description = "Words in the text")
        int wordCount,
        @Schema(description = "Sentences in the text")
        int sentenceCount
) implements ScoreResult {

    public WritingScore {
        criteriaScores = criteriaScores == null ? List.of() : List.copyOf(criteriaScores);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    @Override
    @JsonProperty("subScores")
    public Map<String, Double> subScores() {
        Map<String, Double> scores = new LinkedHashMap<>();
        criteriaScores.forEach(cs -> scores.put(cs.criterionId(), cs.percentage()));
        return scores;
    }

    /**
     * Percentage of the named criterion, or empty when the rubric did not contain it.
     */
    public OptionalDouble criterionPercentage(WritingCriterionKind kind) {
        return criteriaScores.stream()
                .filter(cs -> kind.id().equals(cs.criterionId()))
                .mapToDouble(CriterionScore::percentage)
                .findFirst();
    }
}
