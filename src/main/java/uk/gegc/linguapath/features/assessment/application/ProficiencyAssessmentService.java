package uk.gegc.linguapath.features.assessment.application;

import uk.gegc.linguapath.features.activity.domain.model.ActivityRecord;
import uk.gegc.linguapath.features.activity.domain.model.AggregationWindow;
import uk.gegc.linguapath.features.assessment.domain.model.ProficiencyReport;

import java.util.Collection;

public interface ProficiencyAssessmentService {

    /**
     * Aggregates the records per module, evaluates each module and decides the overall level.
     */
    ProficiencyReport assess(Collection<ActivityRecord> records, AggregationWindow window);
}
