package uk.gegc.linguapath.features.activity.application;

import uk.gegc.linguapath.features.activity.domain.model.ActivityAggregate;
import uk.gegc.linguapath.features.activity.domain.model.ActivityRecord;
import uk.gegc.linguapath.features.activity.domain.model.AggregationWindow;
import uk.gegc.linguapath.features.activity.domain.model.SkillModule;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Map;

/**
 * Reduces raw activity records into accuracy and time statistics.
 * Degenerate input (no records, nothing in the window) yields {@link ActivityAggregate#empty()}.
 */
public interface RecordAggregator {

    /**
     * Aggregates with "today" taken from the application clock.
     */
    ActivityAggregate aggregate(Collection<ActivityRecord> records, AggregationWindow window);

    ActivityAggregate aggregate(Collection<ActivityRecord> records, AggregationWindow window, LocalDate today);

    /**
     * Aggregates each skill module separately. Every module is present in the result;
     * records that feed no module are ignored.
     */
    Map<SkillModule, ActivityAggregate> aggregateByModule(Collection<ActivityRecord> records, AggregationWindow window);
}
