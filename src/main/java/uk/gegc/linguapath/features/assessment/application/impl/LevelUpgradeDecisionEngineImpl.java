package uk.gegc.linguapath.features.assessment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.linguapath.features.activity.domain.model.SkillModule;
import uk.gegc.linguapath.features.assessment.application.LevelUpgradeDecisionEngine;
import uk.gegc.linguapath.features.assessment.domain.model.CefrLevel;
import uk.gegc.linguapath.features.assessment.domain.model.LevelRequirement;
import uk.gegc.linguapath.features.assessment.domain.model.LevelRequirementTable;
import uk.gegc.linguapath.features.assessment.domain.model.LevelThreshold;
import uk.gegc.linguapath.features.assessment.domain.model.LevelUpgrade;
import uk.gegc.linguapath.features.assessment.domain.model.ModuleAssessment;
import uk.gegc.linguapath.features.assessment.domain.model.ProficiencyAssessment;
import uk.gegc.linguapath.shared.exception.AssessmentContractException;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class LevelUpgradeDecisionEngineImpl implements LevelUpgradeDecisionEngine {

    private static final double FULL_PROGRESS = 100.0;

    private static final Comparator<ModuleAssessment> WEAKEST_FIRST = Comparator
            .comparingDouble(ModuleAssessment::currentProgress)
            .thenComparingDouble(ModuleAssessment::accuracy)
            .thenComparing(ModuleAssessment::module);

    private static final Comparator<ModuleAssessment> STRONGEST_FIRST = Comparator
            .comparingDouble(ModuleAssessment::currentProgress).reversed()
            .thenComparing(Comparator.comparingDouble(ModuleAssessment::accuracy).reversed())
            .thenComparing(ModuleAssessment::module);

    private final LevelRequirementTable levelRequirementTable;

    @Override
    public ProficiencyAssessment decide(Collection<ModuleAssessment> assessments) {
        return decide(assessments, levelRequirementTable);
    }

    @Override
    public ProficiencyAssessment decide(Collection<ModuleAssessment> assessments, LevelRequirementTable table) {
        Map<SkillModule, ModuleAssessment> byModule = indexByModule(assessments);

        CefrLevel overallLevel = byModule.values().stream()
                .map(ModuleAssessment::currentLevel)
                .min(Comparator.naturalOrder())
                .orElse(CefrLevel.A1);
        CefrLevel nextLevel = overallLevel.next().orElse(null);

        boolean allComplete = byModule.values().stream()
                .allMatch(a -> a.currentProgress() >= FULL_PROGRESS);
        boolean canUpgrade = allComplete && nextLevel != null;

        double overallProgress = byModule.values().stream()
                .mapToDouble(ModuleAssessment::currentProgress)
                .average()
                .orElse(0.0);

        SkillModule weakest = byModule.values().stream().sorted(WEAKEST_FIRST).findFirst()
                .map(ModuleAssessment::module).orElseThrow();
        SkillModule strongest = byModule.values().stream().sorted(STRONGEST_FIRST).findFirst()
                .map(ModuleAssessment::module).orElseThrow();

        List<LevelRequirement> requirements = nextLevel == null
                ? List.of()
                : byModule.values().stream().map(a -> requirementFor(a, table.threshold(nextLevel, a.module()))).toList();

        log.debug("Decided overall level {} (next={}, canUpgrade={}, progress={}, weakest={}, strongest={})",
                overallLevel, nextLevel, canUpgrade, overallProgress, weakest, strongest);

        return new ProficiencyAssessment(
                overallLevel,
                byModule,
                new LevelUpgrade(canUpgrade, nextLevel, overallProgress, requirements),
                weakest,
                strongest
        );
    }

    private Map<SkillModule, ModuleAssessment> indexByModule(Collection<ModuleAssessment> assessments) {
        if (assessments == null || assessments.size() != SkillModule.values().length) {
            throw new AssessmentContractException("Expected exactly " + SkillModule.values().length
                    + " module assessments but got " + (assessments == null ? 0 : assessments.size()));
        }
        Map<SkillModule, ModuleAssessment> byModule = new EnumMap<>(SkillModule.class);
        for (ModuleAssessment assessment : assessments) {
            if (assessment == null || assessment.module() == null || assessment.currentLevel() == null) {
                throw new AssessmentContractException("Module assessments must name their module and level");
            }
            if (byModule.put(assessment.module(), assessment) != null) {
                throw new AssessmentContractException("Duplicate assessment for module " + assessment.module());
            }
        }
        return byModule;
    }

    private LevelRequirement requirementFor(ModuleAssessment assessment, LevelThreshold threshold) {
        boolean met = threshold.isMetBy(assessment.accuracy(), assessment.totalAttempts());
        return new LevelRequirement(
                assessment.module(),
                assessment.accuracy(),
                threshold.accuracy(),
                threshold.minimumAttempts(),
                assessment.totalAttempts(),
                met,
                describe(assessment, threshold)
        );
    }

    private String describe(ModuleAssessment assessment, LevelThreshold threshold) {
        String name = displayName(assessment.module());
        double accuracyGap = threshold.accuracy() - assessment.accuracy();
        int attemptsGap = threshold.minimumAttempts() - assessment.totalAttempts();
        if (accuracyGap > 0 && attemptsGap > 0) {
            return String.format(Locale.ROOT, "%s: raise accuracy by %.1f points and complete %d more attempts",
                    name, accuracyGap, attemptsGap);
        }
        if (accuracyGap > 0) {
            return String.format(Locale.ROOT, "%s: raise accuracy by %.1f points", name, accuracyGap);
        }
        if (attemptsGap > 0) {
            return String.format(Locale.ROOT, "%s: complete %d more attempts", name, attemptsGap);
        }
        return name + ": requirement met";
    }

    private String displayName(SkillModule module) {
        String lower = module.name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
