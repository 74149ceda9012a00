package uk.gegc.linguapath.features.scoring.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "CriterionScore", description = "Score for one rubric criterion")
public record CriterionScore(
        String criterionId,
        int score,
        int maxScore,
        String feedback
) {

    public double percentage() {
        return maxScore <= 0 ? 100.0 : 100.0 * score / maxScore;
    }
}
