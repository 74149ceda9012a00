package uk.gegc.linguapath.features.assessment.domain.model;

import uk.gegc.linguapath.features.activity.domain.model.SkillModule;
import uk.gegc.linguapath.shared.exception.InvalidConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable CEFR level x skill module threshold table, validated when it is built.
 */
public final class LevelRequirementTable {

    private final Map<CefrLevel, Map<SkillModule, LevelThreshold>> thresholds;

    private LevelRequirementTable(Map<CefrLevel, Map<SkillModule, LevelThreshold>> thresholds) {
        this.thresholds = thresholds;
    }

    public static LevelRequirementTable defaults() {
        Map<CefrLevel, Map<SkillModule, LevelThreshold>> table = new EnumMap<>(CefrLevel.class);
        table.put(CefrLevel.A1, row(60, 10, 55, 10, 50, 5, 45, 5));
        table.put(CefrLevel.A2, row(70, 15, 65, 15, 60, 10, 55, 8));
        table.put(CefrLevel.B1, row(75, 20, 70, 20, 65, 15, 60, 12));
        table.put(CefrLevel.B2, row(80, 25, 75, 25, 70, 20, 65, 15));
        table.put(CefrLevel.C1, row(85, 30, 80, 30, 75, 25, 70, 20));
        table.put(CefrLevel.C2, row(90, 35, 85, 35, 80, 30, 75, 25));
        return of(table);
    }

    /**
     * @throws InvalidConfigurationException when a level/module pair is missing, a value is out of range,
     *                                       or a module's thresholds decrease from one level to the next
     */
    public static LevelRequirementTable of(Map<CefrLevel, Map<SkillModule, LevelThreshold>> source) {
        if (source == null) {
            throw new InvalidConfigurationException("Level requirement table is missing");
        }
        Map<CefrLevel, Map<SkillModule, LevelThreshold>> copy = new EnumMap<>(CefrLevel.class);
        for (CefrLevel level : CefrLevel.values()) {
            Map<SkillModule, LevelThreshold> row = source.get(level);
            if (row == null) {
                throw new InvalidConfigurationException("No requirements configured for level " + level);
            }
            Map<SkillModule, LevelThreshold> rowCopy = new EnumMap<>(SkillModule.class);
            for (SkillModule module : SkillModule.values()) {
                LevelThreshold threshold = row.get(module);
                if (threshold == null) {
                    throw new InvalidConfigurationException("No requirement configured for " + level + "/" + module);
                }
                if (Double.isNaN(threshold.accuracy()) || threshold.accuracy() < 0 || threshold.accuracy() > 100) {
                    throw new InvalidConfigurationException("Accuracy for " + level + "/" + module
                            + " must be within 0-100 but was " + threshold.accuracy());
                }
                if (threshold.minimumAttempts() < 0) {
                    throw new InvalidConfigurationException("Minimum attempts for " + level + "/" + module
                            + " must not be negative but was " + threshold.minimumAttempts());
                }
                rowCopy.put(module, threshold);
            }
            copy.put(level, Collections.unmodifiableMap(rowCopy));
        }
        for (SkillModule module : SkillModule.values()) {
            LevelThreshold previous = null;
            for (CefrLevel level : CefrLevel.values()) {
                LevelThreshold current = copy.get(level).get(module);
                if (previous != null && (current.accuracy() < previous.accuracy()
                        || current.minimumAttempts() < previous.minimumAttempts())) {
                    throw new InvalidConfigurationException("Requirements for " + module
                            + " must not decrease from one level to the next (at " + level + ")");
                }
                previous = current;
            }
        }
        return new LevelRequirementTable(Collections.unmodifiableMap(copy));
    }

    public LevelThreshold threshold(CefrLevel level, SkillModule module) {
        return thresholds.get(level).get(module);
    }

    public Map<CefrLevel, Map<SkillModule, LevelThreshold>> asMap() {
        return thresholds;
    }

    private static Map<SkillModule, LevelThreshold> row(double readingAccuracy, int readingAttempts,
                                                        double listeningAccuracy, int listeningAttempts,
                                                        double speakingAccuracy, int speakingAttempts,
                                                        double writingAccuracy, int writingAttempts) {
        Map<SkillModule, LevelThreshold> row = new EnumMap<>(SkillModule.class);
        row.put(SkillModule.READING, new LevelThreshold(readingAccuracy, readingAttempts));
        row.put(SkillModule.LISTENING, new LevelThreshold(listeningAccuracy, listeningAttempts));
        row.put(SkillModule.SPEAKING, new LevelThreshold(speakingAccuracy, speakingAttempts));
        row.put(SkillModule.WRITING, new LevelThreshold(writingAccuracy, writingAttempts));
        return row;
    }
}
