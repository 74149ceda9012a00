package uk.gegc.linguapath.features.scoring.application;

import uk.gegc.linguapath.features.scoring.domain.model.WritingRubric;
import uk.gegc.linguapath.features.scoring.domain.model.WritingScore;

import java.util.List;

public interface WritingScorer {

    /**
     * Scores a text against a rubric.
     *
     * @param content   the written text; null is treated as empty
     * @param rubric    the rubric; null falls back to {@link WritingRubric#DEFAULT}
     * @param wordLimit target length in words, or null when the task has none
     * @param keywords  words the task expects to see, or null
     */
    WritingScore score(String content, WritingRubric rubric, Integer wordLimit, List<String> keywords);

    default WritingScore score(String content) {
        return score(content, WritingRubric.DEFAULT, null, List.of());
    }
}
