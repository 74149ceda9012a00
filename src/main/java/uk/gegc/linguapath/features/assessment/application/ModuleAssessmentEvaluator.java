package uk.gegc.linguapath.features.assessment.application;

import uk.gegc.linguapath.features.activity.domain.model.ActivityAggregate;
import uk.gegc.linguapath.features.activity.domain.model.SkillModule;
import uk.gegc.linguapath.features.assessment.domain.model.LevelRequirementTable;
import uk.gegc.linguapath.features.assessment.domain.model.ModuleAssessment;

/**
 * Maps a module's aggregate statistics onto a CEFR level using a threshold table.
 * Pure: the same aggregate and table always give the same assessment.
 */
public interface ModuleAssessmentEvaluator {

    ModuleAssessment evaluate(SkillModule module, ActivityAggregate aggregate, LevelRequirementTable table);

    /**
     * Evaluates against the configured requirement table.
     */
    ModuleAssessment evaluate(SkillModule module, ActivityAggregate aggregate);
}
