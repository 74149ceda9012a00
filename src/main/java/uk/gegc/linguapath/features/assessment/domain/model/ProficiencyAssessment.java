package uk.gegc.linguapath.features.assessment.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.linguapath.features.activity.domain.model.SkillModule;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

@Schema(name = "ProficiencyAssessment", description = "Overall level, upgrade decision and per-module assessments")
public record ProficiencyAssessment(
        @Schema(description = "Lowest current level across the four modules")
        CefrLevel overallLevel,
        @Schema(description = "One assessment per skill module")
        Map<SkillModule, ModuleAssessment> modules,
        LevelUpgrade levelUpgrade,
        @Schema(description = "Module with the lowest progress")
        SkillModule weakestModule,
        @Schema(description = "Module with the highest progress")
        SkillModule strongestModule
) {

    public ProficiencyAssessment {
        modules = modules == null || modules.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(modules));
    }
}
