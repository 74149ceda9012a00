package uk.gegc.linguapath.features.scoring.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Rubric criteria the writing scorer knows a heuristic for.
 */
public enum WritingCriterionKind {
    CONTENT,
    ORGANIZATION,
    GRAMMAR,
    VOCABULARY,
    MECHANICS;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<WritingCriterionKind> fromId(String id) {
        if (id == null) return Optional.empty();
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.id().equals(normalized))
                .findFirst();
    }
}
