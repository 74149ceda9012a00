package uk.gegc.linguapath.features.assessment.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "LevelUpgrade", description = "Upgrade decision for the overall level")
public record LevelUpgrade(
        @Schema(description = "True when every module has reached 100% progress and the overall level is below C2")
        boolean canUpgrade,
        @Schema(description = "Level above the overall level; null at C2", nullable = true)
        CefrLevel nextLevel,
        @Schema(description = "Mean of the four module progress values, 0-100")
        double overallProgress,
        @Schema(description = "Per-module standing against the next overall level; empty at C2")
        List<LevelRequirement> requirements
) {

    public LevelUpgrade {
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
    }
}
