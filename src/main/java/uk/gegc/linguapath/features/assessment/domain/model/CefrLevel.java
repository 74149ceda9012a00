package uk.gegc.linguapath.features.assessment.domain.model;

import java.util.Optional;

/**
 * CEFR proficiency bands in ascending order.
 */
public enum CefrLevel {
    A1,
    A2,
    B1,
    B2,
    C1,
    C2;

    public Optional<CefrLevel> next() {
        CefrLevel[] levels = values();
        return ordinal() + 1 < levels.length ? Optional.of(levels[ordinal() + 1]) : Optional.empty();
    }
}
