package uk.gegc.linguapath.features.assessment.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import uk.gegc.linguapath.BaseUnitTest;
import uk.gegc.linguapath.features.activity.application.RecordAggregator;
import uk.gegc.linguapath.features.activity.domain.model.ActivityAggregate;
import uk.gegc.linguapath.features.activity.domain.model.ActivityRecord;
import uk.gegc.linguapath.features.activity.domain.model.ActivityType;
import uk.gegc.linguapath.features.activity.domain.model.AggregationWindow;
import uk.gegc.linguapath.features.activity.domain.model.SkillModule;
import uk.gegc.linguapath.features.assessment.application.LevelUpgradeDecisionEngine;
import uk.gegc.linguapath.features.assessment.application.ModuleAssessmentEvaluator;
import uk.gegc.linguapath.features.assessment.application.UpgradeAdvisor;
import uk.gegc.linguapath.features.assessment.domain.model.CefrLevel;
import uk.gegc.linguapath.features.assessment.domain.model.LevelUpgrade;
import uk.gegc.linguapath.features.assessment.domain.model.ModuleAssessment;
import uk.gegc.linguapath.features.assessment.domain.model.NextLevelRequirement;
import uk.gegc.linguapath.features.assessment.domain.model.ProficiencyAssessment;
import uk.gegc.linguapath.features.assessment.domain.model.ProficiencyReport;
import uk.gegc.linguapath.features.assessment.domain.model.Trend;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ProficiencyAssessmentServiceImpl Tests")
class ProficiencyAssessmentServiceImplTest extends BaseUnitTest {

    @Mock
    private RecordAggregator recordAggregator;

    @Mock
    private ModuleAssessmentEvaluator moduleAssessmentEvaluator;

    @Mock
    private LevelUpgradeDecisionEngine levelUpgradeDecisionEngine;

    @Mock
    private UpgradeAdvisor upgradeAdvisor;

    @InjectMocks
    private ProficiencyAssessmentServiceImpl service;

    @Test
    @DisplayName("Aggregates per module, evaluates each, decides and adds recommendations")
    @SuppressWarnings("unchecked")
    void assess_runsThePipeline() {
        List<ActivityRecord> records = List.of(
                ActivityRecord.graded(ActivityType.READING, Instant.parse("2024-01-15T10:00:00Z"), 60, 80.0));
        AggregationWindow window = AggregationWindow.unbounded();

        Map<SkillModule, ActivityAggregate> aggregates = new EnumMap<>(SkillModule.class);
        for (SkillModule module : SkillModule.values()) {
            aggregates.put(module, ActivityAggregate.ofTotals(50.0, module.ordinal()));
        }
        when(recordAggregator.aggregateByModule(records, window)).thenReturn(aggregates);
        for (SkillModule module : SkillModule.values()) {
            when(moduleAssessmentEvaluator.evaluate(module, aggregates.get(module))).thenReturn(assessment(module));
        }
        ProficiencyAssessment decided = new ProficiencyAssessment(CefrLevel.A1, Map.of(),
                new LevelUpgrade(false, CefrLevel.A2, 10.0, List.of()), SkillModule.READING, SkillModule.WRITING);
        when(levelUpgradeDecisionEngine.decide(any())).thenReturn(decided);
        when(upgradeAdvisor.recommend(decided)).thenReturn(List.of("Focus on reading comprehension: current accuracy is 50.0%."));

        ProficiencyReport report = service.assess(records, window);

        assertSame(decided, report.assessment());
        assertThat(report.recommendations()).containsExactly("Focus on reading comprehension: current accuracy is 50.0%.");

        ArgumentCaptor<Collection<ModuleAssessment>> captor = ArgumentCaptor.forClass(Collection.class);
        verify(levelUpgradeDecisionEngine).decide(captor.capture());
        assertThat(captor.getValue())
                .extracting(ModuleAssessment::module)
                .containsExactly(SkillModule.values());
        verify(moduleAssessmentEvaluator).evaluate(eq(SkillModule.WRITING), eq(aggregates.get(SkillModule.WRITING)));
    }

    private ModuleAssessment assessment(SkillModule module) {
        return new ModuleAssessment(module, CefrLevel.A1, 50.0, module.ordinal(), 0, Trend.STABLE,
                new NextLevelRequirement(CefrLevel.A2, 70.0, 15, 0.0));
    }
}
