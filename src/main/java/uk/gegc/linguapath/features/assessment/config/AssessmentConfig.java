package uk.gegc.linguapath.features.assessment.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.linguapath.features.activity.domain.model.SkillModule;
import uk.gegc.linguapath.features.assessment.domain.model.CefrLevel;
import uk.gegc.linguapath.features.assessment.domain.model.LevelRequirementTable;
import uk.gegc.linguapath.features.assessment.domain.model.LevelThreshold;
import uk.gegc.linguapath.shared.exception.InvalidConfigurationException;

import java.util.EnumMap;
import java.util.Map;

@Slf4j
@Configuration
public class AssessmentConfig {

    @Bean
    public LevelRequirementTable levelRequirementTable(AssessmentProperties properties) {
        Map<CefrLevel, Map<SkillModule, AssessmentProperties.Threshold>> levels = properties.getLevels();
        if (levels == null || levels.isEmpty()) {
            log.info("No level requirements configured, using built-in CEFR table");
            return LevelRequirementTable.defaults();
        }
        LevelRequirementTable table = LevelRequirementTable.of(toThresholds(levels));
        log.info("Loaded level requirement table for {} levels", table.asMap().size());
        return table;
    }

    static Map<CefrLevel, Map<SkillModule, LevelThreshold>> toThresholds(
            Map<CefrLevel, Map<SkillModule, AssessmentProperties.Threshold>> levels) {
        Map<CefrLevel, Map<SkillModule, LevelThreshold>> converted = new EnumMap<>(CefrLevel.class);
        levels.forEach((level, row) -> {
            Map<SkillModule, LevelThreshold> convertedRow = new EnumMap<>(SkillModule.class);
            if (row != null) {
                row.forEach((module, threshold) -> convertedRow.put(module, toThreshold(level, module, threshold)));
            }
            converted.put(level, convertedRow);
        });
        return converted;
    }

    private static LevelThreshold toThreshold(CefrLevel level, SkillModule module, AssessmentProperties.Threshold threshold) {
        if (threshold == null || threshold.getAccuracy() == null || threshold.getMinimumAttempts() == null) {
            throw new InvalidConfigurationException("Requirement for " + level + "/" + module
                    + " needs both accuracy and minimum-attempts");
        }
        return new LevelThreshold(threshold.getAccuracy(), threshold.getMinimumAttempts());
    }
}
