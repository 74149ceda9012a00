package uk.gegc.linguapath.features.assessment.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import uk.gegc.linguapath.features.activity.domain.model.SkillModule;

@Schema(name = "ModuleAssessment", description = "Estimated CEFR level and upgrade progress for one skill module")
public record ModuleAssessment(
        @Schema(description = "Skill module", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        SkillModule module,
        @Schema(description = "Highest level whose requirements, and those of every level below, are met")
        @NotNull
        CefrLevel currentLevel,
        @Schema(description = "Average accuracy 0-100")
        double accuracy,
        @Schema(description = "Graded attempts")
        int totalAttempts,
        @Schema(description = "Graded attempts counted as correct")
        int correctAttempts,
        @Schema(description = "Last three attempts compared with the three before them")
        Trend recentTrend,
        @Schema(description = "Requirement for the next level")
        @NotNull
        @Valid
        NextLevelRequirement nextLevelRequirement
) {

    public double currentProgress() {
        return nextLevelRequirement == null ? 0.0 : nextLevelRequirement.currentProgress();
    }
}
