package uk.gegc.linguapath.features.assessment.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.linguapath.features.activity.domain.model.SkillModule;

@Schema(name = "LevelRequirement", description = "A module's standing against the next overall level")
public record LevelRequirement(
        SkillModule module,
        double currentAccuracy,
        double requiredAccuracy,
        int minimumAttempts,
        int currentAttempts,
        boolean met,
        @Schema(description = "Human-readable gap, e.g. 'Reading: raise accuracy by 4.0 points and complete 3 more attempts'")
        String description
) {
}
