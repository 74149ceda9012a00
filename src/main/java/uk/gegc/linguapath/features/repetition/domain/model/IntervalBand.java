package uk.gegc.linguapath.features.repetition.domain.model;

public enum IntervalBand {
    SHORT,
    MEDIUM,
    LONG
}
