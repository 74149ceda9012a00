package uk.gegc.linguapath.features.assessment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.linguapath.features.activity.application.RecordAggregator;
import uk.gegc.linguapath.features.activity.domain.model.ActivityAggregate;
import uk.gegc.linguapath.features.activity.domain.model.ActivityRecord;
import uk.gegc.linguapath.features.activity.domain.model.AggregationWindow;
import uk.gegc.linguapath.features.activity.domain.model.SkillModule;
import uk.gegc.linguapath.features.assessment.application.LevelUpgradeDecisionEngine;
import uk.gegc.linguapath.features.assessment.application.ModuleAssessmentEvaluator;
import uk.gegc.linguapath.features.assessment.application.ProficiencyAssessmentService;
import uk.gegc.linguapath.features.assessment.application.UpgradeAdvisor;
import uk.gegc.linguapath.features.assessment.domain.model.ModuleAssessment;
import uk.gegc.linguapath.features.assessment.domain.model.ProficiencyAssessment;
import uk.gegc.linguapath.features.assessment.domain.model.ProficiencyReport;

import java.util.Collection;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProficiencyAssessmentServiceImpl implements ProficiencyAssessmentService {

    private final RecordAggregator recordAggregator;
    private final ModuleAssessmentEvaluator moduleAssessmentEvaluator;
    private final LevelUpgradeDecisionEngine levelUpgradeDecisionEngine;
    private final UpgradeAdvisor upgradeAdvisor;

    @Override
    public ProficiencyReport assess(Collection<ActivityRecord> records, AggregationWindow window) {
        Map<SkillModule, ActivityAggregate> aggregates = recordAggregator.aggregateByModule(records, window);

        List<ModuleAssessment> assessments = aggregates.entrySet().stream()
                .map(entry -> moduleAssessmentEvaluator.evaluate(entry.getKey(), entry.getValue()))
                .toList();

        ProficiencyAssessment assessment = levelUpgradeDecisionEngine.decide(assessments);
        List<String> recommendations = upgradeAdvisor.recommend(assessment);

        log.debug("Proficiency assessed from {} records: overall={}, canUpgrade={}",
                records == null ? 0 : records.size(), assessment.overallLevel(), assessment.levelUpgrade().canUpgrade());
        return new ProficiencyReport(assessment, recommendations);
    }
}
