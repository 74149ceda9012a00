package uk.gegc.linguapath.features.assessment.config;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.linguapath.features.activity.domain.model.SkillModule;
import uk.gegc.linguapath.features.assessment.domain.model.CefrLevel;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Type-safe configuration for the CEFR requirement table,
 * e.g. {@code linguapath.assessment.levels.B1.reading.accuracy=75}.
 */
@Component
@Data
@Validated
@ConfigurationProperties(prefix = "linguapath.assessment")
public class AssessmentProperties {

    /**
     * Thresholds per level and skill module. Leave empty to use the built-in table.
     */
    @NotNull
    private Map<CefrLevel, Map<SkillModule, Threshold>> levels = new LinkedHashMap<>();

    @Data
    public static class Threshold {

        /**
         * Minimum average accuracy, 0-100.
         */
        private Double accuracy;

        /**
         * Minimum number of graded attempts.
         */
        private Integer minimumAttempts;
    }
}
