package uk.gegc.linguapath.features.assessment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.linguapath.features.activity.domain.model.ActivityAggregate;
import uk.gegc.linguapath.features.activity.domain.model.SkillModule;
import uk.gegc.linguapath.features.assessment.application.ModuleAssessmentEvaluator;
import uk.gegc.linguapath.features.assessment.domain.model.CefrLevel;
import uk.gegc.linguapath.features.assessment.domain.model.LevelRequirementTable;
import uk.gegc.linguapath.features.assessment.domain.model.LevelThreshold;
import uk.gegc.linguapath.features.assessment.domain.model.ModuleAssessment;
import uk.gegc.linguapath.features.assessment.domain.model.NextLevelRequirement;
import uk.gegc.linguapath.features.assessment.domain.model.Trend;

@Slf4j
@Service
@RequiredArgsConstructor
public class ModuleAssessmentEvaluatorImpl implements ModuleAssessmentEvaluator {

    private final LevelRequirementTable levelRequirementTable;

    @Override
    public ModuleAssessment evaluate(SkillModule module, ActivityAggregate aggregate) {
        return evaluate(module, aggregate, levelRequirementTable);
    }

    @Override
    public ModuleAssessment evaluate(SkillModule module, ActivityAggregate aggregate, LevelRequirementTable table) {
        ActivityAggregate stats = aggregate == null ? ActivityAggregate.empty() : aggregate;
        double accuracy = clampPercent(stats.averageAccuracy());
        int attempts = Math.max(0, stats.totalAttempts());

        CefrLevel currentLevel = CefrLevel.A1;
        for (CefrLevel level : CefrLevel.values()) {
            if (!table.threshold(level, module).isMetBy(accuracy, attempts)) {
                break;
            }
            currentLevel = level;
        }

        NextLevelRequirement nextRequirement = currentLevel.next()
                .map(next -> requirementFor(next, table.threshold(next, module), accuracy, attempts))
                .orElseGet(NextLevelRequirement::topLevelReached);

        Trend trend = Trend.of(stats.gradedAccuracies());

        log.debug("Evaluated {}: level={}, accuracy={}, attempts={}, progress={}, trend={}",
                module, currentLevel, accuracy, attempts, nextRequirement.currentProgress(), trend);

        return new ModuleAssessment(
                module,
                currentLevel,
                accuracy,
                attempts,
                Math.max(0, Math.min(attempts, stats.correctAttempts())),
                trend,
                nextRequirement
        );
    }

    private NextLevelRequirement requirementFor(CefrLevel level, LevelThreshold threshold, double accuracy, int attempts) {
        double accuracyRatio = threshold.accuracy() <= 0 ? 1.0 : accuracy / threshold.accuracy();
        double attemptsRatio = threshold.minimumAttempts() <= 0 ? 1.0 : (double) attempts / threshold.minimumAttempts();
        double progress = Math.min(100.0, 100.0 * Math.min(accuracyRatio, attemptsRatio));
        return new NextLevelRequirement(level, threshold.accuracy(), threshold.minimumAttempts(), progress);
    }

    private double clampPercent(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(100.0, value));
    }
}
