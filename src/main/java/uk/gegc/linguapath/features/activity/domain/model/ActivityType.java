package uk.gegc.linguapath.features.activity.domain.model;

import java.util.Optional;

public enum ActivityType {
    READING(SkillModule.READING),
    LISTENING(SkillModule.LISTENING),
    SPEAKING(SkillModule.SPEAKING),
    WRITING(SkillModule.WRITING),
    TRANSLATION(null);

    private final SkillModule skillModule;

    ActivityType(SkillModule skillModule) {
        this.skillModule = skillModule;
    }

    /**
     * Skill module this activity counts towards. Dictionary lookups feed no module.
     */
    public Optional<SkillModule> skillModule() {
        return Optional.ofNullable(skillModule);
    }
}
