package uk.gegc.linguapath.features.assessment.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "LevelThreshold", description = "Accuracy and attempt count a module needs to reach a level")
public record LevelThreshold(
        @Schema(description = "Minimum average accuracy 0-100", example = "75")
        double accuracy,
        @Schema(description = "Minimum number of graded attempts", example = "20")
        int minimumAttempts
) {

    public boolean isMetBy(double averageAccuracy, int attempts) {
        return averageAccuracy >= accuracy && attempts >= minimumAttempts;
    }
}
