package uk.gegc.linguapath.features.assessment.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "NextLevelRequirement", description = "What the module needs for the level above its current one")
public record NextLevelRequirement(
        @Schema(description = "Target level; null at C2", nullable = true)
        CefrLevel level,
        @Schema(description = "Required average accuracy; null at C2", nullable = true)
        Double targetAccuracy,
        @Schema(description = "Required graded attempts; null at C2", nullable = true)
        Integer minimumAttempts,
        @Schema(description = "Progress towards the target, 0-100, limited by the weaker of accuracy and attempts")
        double currentProgress
) {

    public static NextLevelRequirement topLevelReached() {
        return new NextLevelRequirement(null, null, null, 100.0);
    }
}
