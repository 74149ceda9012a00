package uk.gegc.linguapath.features.assessment.application;

import uk.gegc.linguapath.features.assessment.domain.model.LevelRequirementTable;
import uk.gegc.linguapath.features.assessment.domain.model.ModuleAssessment;
import uk.gegc.linguapath.features.assessment.domain.model.ProficiencyAssessment;
import uk.gegc.linguapath.shared.exception.AssessmentContractException;

import java.util.Collection;

public interface LevelUpgradeDecisionEngine {

    /**
     * Combines the four module assessments into an overall level and upgrade decision.
     * The overall level is the lowest module level.
     *
     * Requirement descriptions are measured against {@code table}, which should be the table
     * the assessments were evaluated with.
     *
     * @throws AssessmentContractException unless there is exactly one assessment per skill module
     */
    ProficiencyAssessment decide(Collection<ModuleAssessment> assessments, LevelRequirementTable table);

    /**
     * Decides against the configured requirement table.
     */
    ProficiencyAssessment decide(Collection<ModuleAssessment> assessments);
}
