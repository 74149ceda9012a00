package uk.gegc.linguapath.features.activity.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.linguapath.features.activity.application.RecordAggregator;
import uk.gegc.linguapath.features.activity.config.ActivityProperties;
import uk.gegc.linguapath.features.activity.domain.model.ActivityAggregate;
import uk.gegc.linguapath.features.activity.domain.model.ActivityRecord;
import uk.gegc.linguapath.features.activity.domain.model.ActivityType;
import uk.gegc.linguapath.features.activity.domain.model.AggregationWindow;
import uk.gegc.linguapath.features.activity.domain.model.SkillModule;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecordAggregatorImpl implements RecordAggregator {

    private final Clock clock;
    private final ActivityProperties properties;

    @Override
    public ActivityAggregate aggregate(Collection<ActivityRecord> records, AggregationWindow window) {
        return aggregate(records, window, LocalDate.now(clock));
    }

    @Override
    public ActivityAggregate aggregate(Collection<ActivityRecord> records, AggregationWindow window, LocalDate today) {
        AggregationWindow effectiveWindow = window == null ? AggregationWindow.unbounded() : window;
        assert !effectiveWindow.isInverted()
                : "Aggregation window starts after it ends: " + effectiveWindow;
        if (records == null || records.isEmpty() || effectiveWindow.isInverted()) {
            return ActivityAggregate.empty();
        }

        List<ActivityRecord> kept = records.stream()
                .filter(Objects::nonNull)
                .filter(r -> r.type() != null)
                .filter(r -> effectiveWindow.contains(r.timestamp()))
                .sorted(Comparator.comparing(ActivityRecord::timestamp))
                .toList();
        if (kept.isEmpty()) {
            return ActivityAggregate.empty();
        }

        long totalTime = kept.stream().mapToLong(r -> Math.max(0L, r.timeSpentSeconds())).sum();

        List<Double> graded = kept.stream()
                .filter(ActivityRecord::isGraded)
                .map(r -> clampAccuracy(r.accuracy()))
                .toList();
        int correct = (int) graded.stream().filter(a -> a >= properties.getCorrectThreshold()).count();
        double average = graded.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);

        Map<ActivityType, Integer> counts = new EnumMap<>(ActivityType.class);
        kept.forEach(r -> counts.merge(r.type(), 1, Integer::sum));

        int streak = streakDays(kept, today == null ? LocalDate.now(clock) : today);

        log.debug("Aggregated {} records: gradedAttempts={}, correctAttempts={}, averageAccuracy={}, streakDays={}",
                kept.size(), graded.size(), correct, average, streak);

        return new ActivityAggregate(totalTime, graded.size(), correct, average, streak, counts, graded);
    }

    @Override
    public Map<SkillModule, ActivityAggregate> aggregateByModule(Collection<ActivityRecord> records, AggregationWindow window) {
        LocalDate today = LocalDate.now(clock);
        Map<SkillModule, List<ActivityRecord>> grouped = new EnumMap<>(SkillModule.class);
        if (records != null) {
            records.stream()
                    .filter(Objects::nonNull)
                    .filter(r -> r.type() != null)
                    .forEach(r -> r.type().skillModule()
                            .ifPresent(module -> grouped.computeIfAbsent(module, k -> new ArrayList<>()).add(r)));
        }

        Map<SkillModule, ActivityAggregate> result = new EnumMap<>(SkillModule.class);
        for (SkillModule module : SkillModule.values()) {
            result.put(module, aggregate(grouped.getOrDefault(module, List.of()), window, today));
        }
        return result;
    }

    private int streakDays(List<ActivityRecord> records, LocalDate today) {
        ZoneId zone = clock.getZone();
        Set<LocalDate> activeDays = records.stream()
                .map(r -> r.timestamp().atZone(zone).toLocalDate())
                .collect(Collectors.toSet());

        int streak = 0;
        LocalDate day = today;
        while (activeDays.contains(day)) {
            streak++;
            day = day.minusDays(1);
        }
        return streak;
    }

    private double clampAccuracy(double accuracy) {
        if (accuracy < 0.0 || accuracy > 100.0) {
            log.warn("Accuracy {} outside 0-100, clamping", accuracy);
        }
        return Math.max(0.0, Math.min(100.0, accuracy));
    }
}
