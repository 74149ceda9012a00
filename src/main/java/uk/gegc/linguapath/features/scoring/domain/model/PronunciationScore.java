package uk.gegc.linguapath.features.scoring.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Schema(name = "PronunciationScore", description = "Heuristic score of a spoken attempt against its reference text")
public record PronunciationScore(
        @Schema(description = "Overall score 0-100")
        double overallScore,
        @Schema(description = "Share of reference words matched, 0-100")
        double accuracyScore,
        @Schema(description = "Recogniser confidence scaled to 0-100")
        int fluencyScore,
        @Schema(description = "Pronunciation estimate, 0-100")
        int pronunciationScore,
        @Schema(description = "Feedback band for the overall score")
        String feedback,
        @Schema(description = "Up to three mismatched word positions")
        List<PronunciationMistake> mistakes
) implements ScoreResult {

    public PronunciationScore {
        mistakes = mistakes == null ? List.of() : List.copyOf(mistakes);
    }

    @Override
    @JsonProperty("subScores")
    public Map<String, Double> subScores() {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("accuracy", accuracyScore);
        scores.put("fluency", (double) fluencyScore);
        scores.put("pronunciation", (double) pronunciationScore);
        return scores;
    }
}
