package uk.gegc.linguapath.features.assessment.application;

import org.springframework.stereotype.Component;
import uk.gegc.linguapath.features.activity.domain.model.SkillModule;
import uk.gegc.linguapath.features.assessment.domain.model.LevelRequirement;
import uk.gegc.linguapath.features.assessment.domain.model.ModuleAssessment;
import uk.gegc.linguapath.features.assessment.domain.model.ProficiencyAssessment;
import uk.gegc.linguapath.features.assessment.domain.model.Trend;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Study recommendations derived from a proficiency assessment.
 */
@Component
public class UpgradeAdvisor {

    static final int MAX_RECOMMENDATIONS = 5;
    static final int MAX_REQUIREMENT_LINES = 2;

    public List<String> recommend(ProficiencyAssessment assessment) {
        List<String> recommendations = new ArrayList<>();

        ModuleAssessment weakest = assessment.modules().get(assessment.weakestModule());
        if (weakest != null) {
            recommendations.add(String.format(Locale.ROOT, "Focus on %s: current accuracy is %.1f%%.",
                    skillName(weakest.module()), weakest.accuracy()));
        }

        if (!assessment.levelUpgrade().canUpgrade() && assessment.levelUpgrade().nextLevel() != null) {
            assessment.levelUpgrade().requirements().stream()
                    .filter(requirement -> !requirement.met())
                    .limit(MAX_REQUIREMENT_LINES)
                    .map(LevelRequirement::description)
                    .forEach(recommendations::add);
        }

        assessment.modules().values().stream()
                .filter(module -> module.recentTrend() == Trend.DOWN)
                .map(module -> capitalize(skillName(module.module()))
                        + " results have dropped recently; schedule extra practice.")
                .forEach(recommendations::add);

        return recommendations.size() > MAX_RECOMMENDATIONS
                ? List.copyOf(recommendations.subList(0, MAX_RECOMMENDATIONS))
                : List.copyOf(recommendations);
    }

    private String skillName(SkillModule module) {
        return switch (module) {
            case READING -> "reading comprehension";
            case LISTENING -> "listening comprehension";
            case SPEAKING -> "speaking";
            case WRITING -> "writing";
        };
    }

    private String capitalize(String text) {
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
