package uk.gegc.linguapath.features.activity.domain.model;

/**
 * The four skill areas a learner is assessed on. Declaration order is the
 * tie-break order used when two modules rank equally.
 */
public enum SkillModule {
    READING,
    LISTENING,
    SPEAKING,
    WRITING
}
